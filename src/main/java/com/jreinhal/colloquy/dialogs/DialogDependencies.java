package com.jreinhal.colloquy.dialogs;

import java.util.List;

/**
 * Implemented by dialogs that need other dialogs registered alongside them in the same set.
 */
public interface DialogDependencies {

    List<Dialog> getDependencies();
}
