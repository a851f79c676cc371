package com.jreinhal.colloquy.dialogs;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dialog that runs other dialogs on a private stack kept inside its own frame.
 *
 * <p>Events nothing else handled reach {@link #onPostBubbleEvent}, which dispatches them
 * by kind through a handler table. Kinds without a handler stay unhandled.</p>
 */
public abstract class DialogContainer extends AbstractDialog {
    private static final Logger log = LoggerFactory.getLogger(DialogContainer.class);
    private static final BiPredicate<DialogContext, DialogEvent> UNHANDLED = (dc, event) -> false;

    protected final DialogSet dialogs = new DialogSet();
    private final Map<DialogEvents, BiPredicate<DialogContext, DialogEvent>> postBubbleHandlers = new EnumMap<>(DialogEvents.class);

    protected DialogContainer(String id) {
        super(id);
        this.postBubbleHandlers.put(DialogEvents.VERSION_CHANGED, this::onVersionChanged);
    }

    /**
     * Context over this container's private stack, parented to {@code dc}. {@code dc}'s
     * active frame must belong to this container.
     */
    public abstract DialogContext createChildContext(DialogContext dc);

    public Dialog findDialog(String dialogId) {
        return this.dialogs.find(dialogId);
    }

    public DialogSet getDialogs() {
        return this.dialogs;
    }

    @Override
    public String getVersion() {
        return getId() + ":" + this.dialogs.getVersion();
    }

    @Override
    public boolean onPostBubbleEvent(DialogContext dc, DialogEvent event) {
        return this.postBubbleHandlers.getOrDefault(event.kind(), UNHANDLED).test(dc, event);
    }

    protected void onEvent(DialogEvents kind, BiPredicate<DialogContext, DialogEvent> handler) {
        if (kind == DialogEvents.CUSTOM) {
            throw new IllegalArgumentException("Custom events are dispatched through onPreBubbleEvent");
        }
        this.postBubbleHandlers.put(kind, handler);
    }

    private boolean onVersionChanged(DialogContext dc, DialogEvent event) {
        DialogInstance active = dc.getActiveDialog();
        log.info("Unhandled dialog event: {}. Active dialog: {}", event.name(), active == null ? "none" : active.getId());
        return false;
    }
}
