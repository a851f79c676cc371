package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.dialogs.memory.DialogMemory;
import com.jreinhal.colloquy.dialogs.memory.MemoryScope;
import com.jreinhal.colloquy.dialogs.memory.ScopePath;
import com.jreinhal.colloquy.dialogs.prompts.PromptOptions;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor over one dialog stack for the current turn.
 *
 * <p>Index 0 of the stack is the active frame. A context whose active dialog is a
 * {@link DialogContainer} has a child context over the container's private stack; the
 * child's parent is this context.</p>
 */
public class DialogContext {
    private static final Logger log = LoggerFactory.getLogger(DialogContext.class);

    private final DialogSet dialogs;
    private final TurnContext context;
    private final DialogState state;
    private final DialogContextTree tree;
    private final int index;

    public DialogContext(DialogSet dialogs, TurnContext context, DialogState state) {
        this.dialogs = dialogs;
        this.context = context;
        this.state = state;
        this.tree = new DialogContextTree(dialogs.getMemoryScopes());
        this.index = this.tree.register(this, DialogContextTree.ROOT);
    }

    public DialogContext(DialogSet dialogs, DialogContext parent, DialogState state) {
        this.dialogs = dialogs;
        this.context = parent.context;
        this.state = state;
        this.tree = parent.tree;
        this.index = this.tree.register(this, parent.index);
    }

    public DialogSet getDialogs() {
        return this.dialogs;
    }

    public TurnContext getContext() {
        return this.context;
    }

    /**
     * The live stack; index 0 is the active frame.
     */
    public List<DialogInstance> getStack() {
        return this.state.getDialogStack();
    }

    public DialogInstance getActiveDialog() {
        List<DialogInstance> stack = getStack();
        return stack.isEmpty() ? null : stack.get(0);
    }

    public DialogContext getParent() {
        return this.tree.parentOf(this.index);
    }

    /**
     * Context over the private stack of the active dialog, or null when the active dialog
     * is not a container.
     */
    public DialogContext getChild() {
        DialogInstance instance = getActiveDialog();
        if (instance == null) {
            return null;
        }
        DialogContext cached = this.tree.cachedChild(this.index, instance);
        if (cached != null) {
            return cached;
        }
        Dialog dialog = findDialog(instance.getId());
        if (!(dialog instanceof DialogContainer container)) {
            return null;
        }
        DialogContext child = container.createChildContext(this);
        if (child != null) {
            this.tree.cacheChild(this.index, instance, child);
        }
        return child;
    }

    public DialogTurnResult beginDialog(String dialogId) {
        return beginDialog(dialogId, null);
    }

    public DialogTurnResult beginDialog(String dialogId, Object options) {
        if (dialogId == null || dialogId.isBlank()) {
            throw new IllegalArgumentException("DialogContext.beginDialog(): a dialog id is required");
        }
        Dialog dialog = findDialog(dialogId);
        if (dialog == null) {
            throw new DialogContextException("DialogContext.beginDialog(): a dialog with an id of '" + dialogId + "' wasn't found.", DialogContextSnapshot.of(this));
        }
        DialogInstance instance = new DialogInstance(dialogId, dialog.getVersion());
        getStack().add(0, instance);
        log.debug("Begin dialog {} (depth {})", dialogId, getStack().size());
        return invoke(() -> dialog.beginDialog(this, options));
    }

    /**
     * Begins a prompt. Prompts require options.
     */
    public DialogTurnResult prompt(String dialogId, PromptOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("DialogContext.prompt(): prompt options are required");
        }
        return beginDialog(dialogId, options);
    }

    public DialogTurnResult continueDialog() {
        DialogInstance instance = getActiveDialog();
        if (instance == null) {
            return new DialogTurnResult(DialogTurnStatus.EMPTY);
        }
        Dialog dialog = findDialog(instance.getId());
        if (dialog == null) {
            throw new DialogContextException("DialogContext.continueDialog(): Failed to continue dialog. A dialog with id '" + instance.getId() + "' wasn't found.", DialogContextSnapshot.of(this));
        }
        checkForVersionChange(instance, dialog);
        return invoke(() -> dialog.continueDialog(this));
    }

    public DialogTurnResult endDialog() {
        return endDialog(null);
    }

    /**
     * Pops the active frame and resumes the frame below it with {@code result}. With nothing
     * left to resume the stack completes with {@code result}.
     */
    public DialogTurnResult endDialog(Object result) {
        endActiveDialog(DialogReason.END_CALLED, result);
        DialogInstance instance = getActiveDialog();
        if (instance == null) {
            return new DialogTurnResult(DialogTurnStatus.COMPLETE, result);
        }
        Dialog dialog = findDialog(instance.getId());
        if (dialog == null) {
            throw new DialogContextException("DialogContext.endDialog(): Can't resume previous dialog. A dialog with an id of '" + instance.getId() + "' wasn't found.", DialogContextSnapshot.of(this));
        }
        return invoke(() -> dialog.resumeDialog(this, DialogReason.END_CALLED, result));
    }

    public DialogTurnResult replaceDialog(String dialogId, Object options) {
        endActiveDialog(DialogReason.REPLACE_CALLED, null);
        return beginDialog(dialogId, options);
    }

    public DialogTurnResult cancelAllDialogs() {
        return cancelAllDialogs(false, null, null);
    }

    /**
     * Ends every frame with {@link DialogReason#CANCEL_CALLED}. Before each frame below the
     * first is ended the cancel event is offered to it; a frame that handles it stops the
     * cancellation. An empty stack is {@link DialogTurnStatus#EMPTY} unless ancestors are
     * being cancelled too.
     *
     * @param cancelParents continue into ancestor contexts once this stack is empty
     */
    public DialogTurnResult cancelAllDialogs(boolean cancelParents, String eventName, Object eventValue) {
        String name = eventName == null ? DialogEvents.CANCEL_DIALOG.eventName() : eventName;
        if (!cancelParents && getStack().isEmpty()) {
            return new DialogTurnResult(DialogTurnStatus.EMPTY);
        }
        boolean notify = false;
        DialogContext dc = this;
        while (dc != null) {
            if (!dc.getStack().isEmpty()) {
                if (notify && dc.emitEvent(name, eventValue, false, false)) {
                    break;
                }
                dc.endActiveDialog(DialogReason.CANCEL_CALLED, null);
            } else {
                dc = cancelParents ? dc.getParent() : null;
            }
            notify = true;
        }
        log.debug("Cancelled dialogs (cancelParents={})", cancelParents);
        return new DialogTurnResult(DialogTurnStatus.CANCELLED);
    }

    public void repromptDialog() {
        DialogInstance instance = getActiveDialog();
        if (instance == null) {
            return;
        }
        boolean handled = emitEvent(DialogEvents.REPROMPT_DIALOG.eventName(), null, false, false);
        if (handled) {
            return;
        }
        Dialog dialog = findDialog(instance.getId());
        if (dialog == null) {
            throw new DialogContextException("DialogContext.repromptDialog(): Can't find a dialog with an id of '" + instance.getId() + "'.", DialogContextSnapshot.of(this));
        }
        invoke(() -> {
            dialog.repromptDialog(this.context, instance);
            return null;
        });
    }

    /**
     * Raises an event on the active dialog of this context, or of the deepest active child
     * when {@code fromLeaf} is set.
     *
     * @return true when the event was handled
     */
    public boolean emitEvent(String name, Object value, boolean bubble, boolean fromLeaf) {
        DialogEvent event = new DialogEvent(bubble, name, value);
        DialogContext dc = this;
        if (fromLeaf) {
            DialogContext child = dc.getChild();
            while (child != null) {
                dc = child;
                child = dc.getChild();
            }
        }
        DialogInstance instance = dc.getActiveDialog();
        if (instance == null) {
            return false;
        }
        Dialog dialog = dc.findDialog(instance.getId());
        if (dialog == null) {
            return false;
        }
        DialogContext target = dc;
        return Boolean.TRUE.equals(invoke(() -> dialog.onDialogEvent(target, event)));
    }

    /**
     * Searches this context's set, then each ancestor's.
     */
    public Dialog findDialog(String dialogId) {
        Dialog dialog = this.dialogs.find(dialogId);
        if (dialog == null && getParent() != null) {
            dialog = getParent().findDialog(dialogId);
        }
        return dialog;
    }

    public Object getMemory(String scopeName) {
        return scope(scopeName).getMemory(this);
    }

    public void setMemory(String scopeName, Object value) {
        scope(scopeName).setMemory(this, value);
    }

    /**
     * Path-based access ({@code turn.lastResult}, {@code this.options}) over the memory scopes.
     */
    public DialogMemory getDialogMemory() {
        return new DialogMemory(this, this.tree.memoryScopes());
    }

    private MemoryScope scope(String scopeName) {
        MemoryScope scope = this.tree.memoryScopes().get(scopeName);
        if (scope == null) {
            throw new IllegalArgumentException("Unknown memory scope '" + scopeName + "'");
        }
        return scope;
    }

    private void endActiveDialog(DialogReason reason, Object result) {
        DialogInstance instance = getActiveDialog();
        if (instance == null) {
            return;
        }
        Dialog dialog = findDialog(instance.getId());
        if (dialog != null) {
            invoke(() -> {
                dialog.endDialog(this.context, instance, reason);
                return null;
            });
        }
        getStack().remove(0);
        if (reason != DialogReason.CANCEL_CALLED) {
            this.context.getTurnMemory().put(ScopePath.LAST_RESULT, result);
        }
        log.debug("End dialog {} ({})", instance.getId(), reason);
    }

    private void checkForVersionChange(DialogInstance instance, Dialog dialog) {
        String current = dialog.getVersion();
        if (current != null && instance.getVersion() != null && !current.equals(instance.getVersion())) {
            instance.setVersion(current);
            boolean handled = emitEvent(DialogEvents.VERSION_CHANGED.eventName(), instance.getId(), true, true);
            if (!handled) {
                log.warn("Version of dialog {} changed since it was started and nothing handled the change", instance.getId());
            }
        } else if (instance.getVersion() == null) {
            instance.setVersion(current);
        }
    }

    private <T> T invoke(Supplier<T> call) {
        try {
            return call.get();
        } catch (DialogContextException | DialogConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DialogContextException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), DialogContextSnapshot.of(this), e);
        }
    }
}
