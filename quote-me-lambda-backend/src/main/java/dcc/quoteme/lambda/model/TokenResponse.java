package dcc.quoteme.lambda.model;

import com.google.gson.annotations.SerializedName;

/**
 * Body returned by the Cognito /oauth2/token endpoint.
 */
public class TokenResponse {
    @SerializedName("access_token")
    private String accessToken;
    @SerializedName("id_token")
    private String idToken;
    @SerializedName("refresh_token")
    private String refreshToken;
    private String error;
    @SerializedName("error_description")
    private String errorDescription;

    public TokenResponse() {
    }

    public static TokenResponse failure(String error, String errorDescription) {
        TokenResponse response = new TokenResponse();
        response.error = error;
        response.errorDescription = errorDescription;
        return response;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getIdToken() {
        return idToken;
    }

    public void setIdToken(String idToken) {
        this.idToken = idToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public void setRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
    }

    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }
}
