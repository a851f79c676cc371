package com.jreinhal.colloquy.dialogs;

/**
 * Holds the id of a dialog. Subclasses that are not given an id compute one in
 * {@link #onComputeId()}.
 */
public abstract class AbstractDialog implements Dialog {
    private String id;

    protected AbstractDialog(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        if (this.id == null) {
            this.id = onComputeId();
        }
        return this.id;
    }

    @Override
    public void setId(String id) {
        this.id = id;
    }

    protected String onComputeId() {
        throw new DialogConfigurationException(getClass().getSimpleName() + ": no id assigned and onComputeId() is not implemented.");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getId() + "]";
    }
}
