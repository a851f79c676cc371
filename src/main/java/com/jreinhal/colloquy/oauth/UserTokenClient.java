package com.jreinhal.colloquy.oauth;

import com.jreinhal.colloquy.activity.ConversationReference;
import java.util.List;

/**
 * The remote user token service.
 */
public interface UserTokenClient {

    /**
     * @param code magic code relayed by the user, or null
     * @return the token, or {@link TokenResponse#empty()} when the user has none
     */
    TokenResponse getUserToken(String connectionName, String channelId, String userId, String code);

    void signOut(String userId, String connectionName, String channelId);

    SignInResource getSignInResource(String connectionName, ConversationReference conversation, ConversationReference relatesTo);

    /**
     * @return the exchanged token, or {@link TokenResponse#empty()} when the exchange failed
     */
    TokenResponse exchangeToken(String userId, String connectionName, String channelId, TokenExchangeRequest request);

    TokenOrSignInResourceResponse getTokenOrSignInResource(String userId, String connectionName, String channelId,
                                                           ConversationReference conversation,
                                                           ConversationReference relatesTo, String code);

    List<TokenStatus> getTokenStatus(String userId, String channelId, String include);
}
