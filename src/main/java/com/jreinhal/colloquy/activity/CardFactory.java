package com.jreinhal.colloquy.activity;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public final class CardFactory {
    public static final String OAUTH_CARD_CONTENT_TYPE = "application/vnd.microsoft.card.oauth";

    private CardFactory() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OAuthCardContent(
            String text,
            String connectionName,
            List<CardAction> buttons,
            Object tokenExchangeResource,
            Object tokenPostResource
    ) {}

    /**
     * Builds the sign-in card attachment. The single button carries the sign-in link
     * returned by the token service.
     */
    public static Attachment oauthCard(String connectionName, String title, String text, String signInLink,
                                       Object tokenExchangeResource, Object tokenPostResource) {
        CardAction button = new CardAction(CardAction.SIGN_IN, title, signInLink);
        OAuthCardContent content = new OAuthCardContent(text, connectionName, List.of(button),
                tokenExchangeResource, tokenPostResource);
        return new Attachment(OAUTH_CARD_CONTENT_TYPE, content);
    }

    public static boolean isOAuthCard(Attachment attachment) {
        return attachment != null && OAUTH_CARD_CONTENT_TYPE.equals(attachment.contentType());
    }
}
