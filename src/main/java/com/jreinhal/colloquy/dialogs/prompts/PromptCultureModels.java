package com.jreinhal.colloquy.dialogs.prompts;

import java.util.List;
import java.util.Locale;

public final class PromptCultureModels {
    public static final PromptCultureModel CHINESE = new PromptCultureModel("zh-cn", ", ", " 要么 ", "， 要么 ", "是的", "不");
    public static final PromptCultureModel DUTCH = new PromptCultureModel("nl-nl", ", ", " of ", ", of ", "Ja", "Nee");
    public static final PromptCultureModel ENGLISH = new PromptCultureModel("en-us", ", ", " or ", ", or ", "Yes", "No");
    public static final PromptCultureModel FRENCH = new PromptCultureModel("fr-fr", ", ", " ou ", ", ou ", "Oui", "Non");
    public static final PromptCultureModel GERMAN = new PromptCultureModel("de-de", ", ", " oder ", ", oder ", "Ja", "Nein");
    public static final PromptCultureModel ITALIAN = new PromptCultureModel("it-it", ", ", " o ", " o ", "Si", "No");
    public static final PromptCultureModel JAPANESE = new PromptCultureModel("ja-jp", "、 ", " または ", "、 または ", "はい", "いいえ");
    public static final PromptCultureModel PORTUGUESE = new PromptCultureModel("pt-br", ", ", " ou ", ", ou ", "Sim", "Não");
    public static final PromptCultureModel SPANISH = new PromptCultureModel("es-es", ", ", " o ", ", o ", "Sí", "No");

    private static final List<PromptCultureModel> SUPPORTED = List.of(
            CHINESE, DUTCH, ENGLISH, FRENCH, GERMAN, ITALIAN, JAPANESE, PORTUGUESE, SPANISH);

    private PromptCultureModels() {
    }

    public static List<PromptCultureModel> getSupportedCultures() {
        return SUPPORTED;
    }

    /**
     * Lower-cases the code and, when it is not supported as is, maps it to a supported
     * culture of the same language ({@code "en-GB"} to {@code "en-us"}). Unknown languages
     * come back unchanged.
     */
    public static String mapToNearestLanguage(String cultureCode) {
        if (cultureCode == null || cultureCode.isBlank()) {
            return cultureCode;
        }
        String code = cultureCode.toLowerCase(Locale.ROOT);
        if (SUPPORTED.stream().anyMatch(culture -> culture.locale().equals(code))) {
            return code;
        }
        String prefix = code.split("-")[0].trim();
        return SUPPORTED.stream()
                .map(PromptCultureModel::locale)
                .filter(locale -> locale.startsWith(prefix))
                .reduce((first, second) -> second)
                .orElse(code);
    }
}
