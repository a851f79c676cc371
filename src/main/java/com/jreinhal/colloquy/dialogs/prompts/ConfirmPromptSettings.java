package com.jreinhal.colloquy.dialogs.prompts;

import com.jreinhal.colloquy.activity.Activity;
import com.jreinhal.colloquy.dialogs.choices.Choice;
import com.jreinhal.colloquy.dialogs.choices.ChoiceFactoryOptions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Locale resolution and yes/no choices shared by the confirm renderer and recognizer.
 * Without explicit defaults every supported culture gets its own yes/no pair.
 */
public class ConfirmPromptSettings {

    public record ChoiceDefaults(List<Choice> choices, ChoiceFactoryOptions options) {}

    private final String defaultLocale;
    private final Map<String, ChoiceDefaults> choiceDefaults;
    private List<Choice> confirmChoices;
    private ChoiceFactoryOptions choiceOptions;
    private ListStyle style = ListStyle.AUTO;

    public ConfirmPromptSettings() {
        this(null, null);
    }

    public ConfirmPromptSettings(String defaultLocale, Map<String, ChoiceDefaults> choiceDefaults) {
        this.defaultLocale = defaultLocale;
        this.choiceDefaults = choiceDefaults == null ? supportedCultureDefaults() : Map.copyOf(choiceDefaults);
    }

    private static Map<String, ChoiceDefaults> supportedCultureDefaults() {
        Map<String, ChoiceDefaults> supported = new LinkedHashMap<>();
        for (PromptCultureModel culture : PromptCultureModels.getSupportedCultures()) {
            supported.put(culture.locale(), new ChoiceDefaults(
                    List.of(Choice.of(culture.yesInLanguage()), Choice.of(culture.noInLanguage())),
                    new ChoiceFactoryOptions(culture.separator(), culture.inlineOr(), culture.inlineOrMore(), true)));
        }
        return supported;
    }

    /**
     * Activity locale, then the default locale, then English; a culture without choice
     * defaults falls back to English too.
     */
    public String determineCulture(Activity activity) {
        String requested = activity.getLocale() != null ? activity.getLocale()
                : this.defaultLocale != null ? this.defaultLocale
                : PromptCultureModels.ENGLISH.locale();
        String culture = PromptCultureModels.mapToNearestLanguage(requested);
        if (culture == null || !this.choiceDefaults.containsKey(culture)) {
            culture = PromptCultureModels.ENGLISH.locale();
        }
        return culture;
    }

    public List<Choice> choicesFor(String culture) {
        return this.confirmChoices != null ? this.confirmChoices : defaultsFor(culture).choices();
    }

    public ChoiceFactoryOptions optionsFor(String culture) {
        return this.choiceOptions != null ? this.choiceOptions : defaultsFor(culture).options();
    }

    private ChoiceDefaults defaultsFor(String culture) {
        ChoiceDefaults defaults = this.choiceDefaults.get(culture);
        return defaults != null ? defaults : this.choiceDefaults.get(PromptCultureModels.ENGLISH.locale());
    }

    public String getDefaultLocale() {
        return this.defaultLocale;
    }

    /**
     * Overrides the culture's yes/no pair. The first choice means true.
     */
    public ConfirmPromptSettings setConfirmChoices(List<Choice> confirmChoices) {
        if (confirmChoices != null && confirmChoices.size() != 2) {
            throw new IllegalArgumentException("A confirm prompt needs exactly two choices");
        }
        this.confirmChoices = confirmChoices;
        return this;
    }

    public ConfirmPromptSettings setChoiceOptions(ChoiceFactoryOptions choiceOptions) {
        this.choiceOptions = choiceOptions;
        return this;
    }

    public ListStyle getStyle() {
        return this.style;
    }

    public ConfirmPromptSettings setStyle(ListStyle style) {
        this.style = style == null ? ListStyle.AUTO : style;
        return this;
    }
}
