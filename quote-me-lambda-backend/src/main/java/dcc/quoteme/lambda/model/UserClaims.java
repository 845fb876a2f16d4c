package dcc.quoteme.lambda.model;

import java.util.List;

/**
 * Identity of the caller as asserted by the Cognito authorizer.
 */
public class UserClaims {
    public static final String ADMIN_GROUP = "Admins";

    private final String username;
    private final String email;
    private final String sub;
    private final List<String> groups;

    public UserClaims(String username, String email, String sub, List<String> groups) {
        this.username = username;
        this.email = email;
        this.sub = sub;
        this.groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public static UserClaims anonymous() {
        return new UserClaims("unknown", "", "", List.of());
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public String getSub() {
        return sub;
    }

    public List<String> getGroups() {
        return groups;
    }

    public boolean isAdmin() {
        return groups.contains(ADMIN_GROUP);
    }

    public boolean hasEmail() {
        return email != null && !email.isEmpty();
    }
}
