package com.jreinhal.colloquy.dialogs;

/**
 * One step of a {@link WaterfallDialog}.
 */
@FunctionalInterface
public interface WaterfallStep {

    DialogTurnResult run(WaterfallStepContext step);
}
