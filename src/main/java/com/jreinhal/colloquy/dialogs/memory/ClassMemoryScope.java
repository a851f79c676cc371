package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.Dialog;
import com.jreinhal.colloquy.dialogs.DialogContext;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ReflectionUtils;

/**
 * Copy of the public instance fields of the active dialog. {@link ValueExpression} fields
 * are evaluated; one that fails is left out of the copy.
 */
public class ClassMemoryScope extends MemoryScope {
    private static final Logger log = LoggerFactory.getLogger(ClassMemoryScope.class);

    public ClassMemoryScope() {
        this(ScopePath.CLASS);
    }

    protected ClassMemoryScope(String name) {
        super(name, false);
    }

    @Override
    public Object getMemory(DialogContext dc) {
        Map<String, Object> clone = new LinkedHashMap<>();
        if (dc.getActiveDialog() == null) {
            return clone;
        }
        Dialog dialog = onFindDialog(dc);
        if (dialog == null) {
            return clone;
        }
        ReflectionUtils.doWithFields(dialog.getClass(), field -> {
            Object value = ReflectionUtils.getField(field, dialog);
            if (value instanceof ValueExpression expression) {
                try {
                    clone.put(field.getName(), expression.evaluate(dc.getDialogMemory()));
                } catch (RuntimeException e) {
                    log.debug("Skipping field {} of dialog {}: {}", field.getName(), dialog.getId(), e.getMessage());
                }
            } else {
                clone.put(field.getName(), value);
            }
        }, field -> Modifier.isPublic(field.getModifiers()) && !Modifier.isStatic(field.getModifiers()));
        return clone;
    }

    protected Dialog onFindDialog(DialogContext dc) {
        return dc.findDialog(dc.getActiveDialog().getId());
    }
}
