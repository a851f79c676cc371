package com.jreinhal.colloquy.dialogs;

import com.jreinhal.colloquy.dialogs.memory.MemoryScopes;
import com.jreinhal.colloquy.state.StatePropertyAccessor;
import com.jreinhal.colloquy.turn.TurnContext;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of dialogs addressable by id within one namespace.
 *
 * <p>Ids are made unique when a dialog is added: a colliding dialog is renamed
 * {@code name2}, {@code name3}, ... Dependencies a dialog declares through
 * {@link DialogDependencies} are registered with it.</p>
 */
public class DialogSet {
    private static final Logger log = LoggerFactory.getLogger(DialogSet.class);

    private final Map<String, Dialog> dialogs = new LinkedHashMap<>();
    private final StatePropertyAccessor<DialogState> dialogState;
    private MemoryScopes memoryScopes = MemoryScopes.defaults();
    private String versionSource;
    private String version;

    public DialogSet() {
        this(null);
    }

    /**
     * @param dialogState where the root stack is persisted; required by {@link #createContext}
     */
    public DialogSet(StatePropertyAccessor<DialogState> dialogState) {
        this.dialogState = dialogState;
    }

    public DialogSet add(Dialog dialog) {
        if (dialog == null) {
            throw new IllegalArgumentException("DialogSet.add(): a dialog is required");
        }
        add(dialog, Collections.newSetFromMap(new IdentityHashMap<>()));
        return this;
    }

    private void add(Dialog dialog, Set<Dialog> visited) {
        if (!visited.add(dialog)) {
            return;
        }
        String id = dialog.getId();
        if (id == null || id.isBlank()) {
            throw new DialogConfigurationException("DialogSet.add(): " + dialog.getClass().getSimpleName() + " has no id");
        }
        Dialog existing = this.dialogs.get(id);
        if (existing == dialog) {
            return;
        }
        if (existing != null) {
            int suffix = 2;
            while (this.dialogs.containsKey(id + suffix)) {
                suffix++;
            }
            log.debug("Dialog id '{}' already registered, renaming to '{}'", id, id + suffix);
            dialog.setId(id + suffix);
        }
        this.dialogs.put(dialog.getId(), dialog);
        this.version = null;
        if (dialog instanceof DialogDependencies withDependencies) {
            for (Dialog dependency : withDependencies.getDependencies()) {
                add(dependency, visited);
            }
        }
    }

    public DialogContext createContext(TurnContext context) {
        if (this.dialogState == null) {
            throw new DialogConfigurationException("DialogSet.createContext(): the set was created without a dialog state accessor");
        }
        DialogState state = this.dialogState.get(context, DialogState::new);
        return new DialogContext(this, context, state);
    }

    public Dialog find(String dialogId) {
        return dialogId == null ? null : this.dialogs.get(dialogId);
    }

    public Collection<Dialog> getDialogs() {
        return Collections.unmodifiableCollection(this.dialogs.values());
    }

    /**
     * Hash over every member's version. Recomputed when any member reports a different
     * version than it did at the previous call.
     */
    public String getVersion() {
        StringBuilder source = new StringBuilder();
        for (Dialog dialog : this.dialogs.values()) {
            String memberVersion = dialog.getVersion();
            if (memberVersion != null) {
                source.append('|').append(memberVersion);
            }
        }
        String current = source.toString();
        if (this.version == null || !current.equals(this.versionSource)) {
            this.versionSource = current;
            this.version = sha256(current);
        }
        return this.version;
    }

    public MemoryScopes getMemoryScopes() {
        return this.memoryScopes;
    }

    /**
     * Scopes available to contexts created from this set, e.g. with conversation and user
     * state attached.
     */
    public DialogSet setMemoryScopes(MemoryScopes memoryScopes) {
        this.memoryScopes = memoryScopes == null ? MemoryScopes.defaults() : memoryScopes;
        return this;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
