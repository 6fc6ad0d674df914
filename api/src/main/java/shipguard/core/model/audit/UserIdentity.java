package shipguard.core.model.audit;

/**
 * Identity attached to an audit event. Any component may be null; login events
 * reported by the login page usually carry only the email.
 *
 * @param userId the user identifier
 * @param userEmail the user email
 * @param userRole the role at the time of the event
 */
public record UserIdentity(String userId, String userEmail, String userRole) {

    public static UserIdentity ofEmail(String email) {
        return new UserIdentity(null, email, null);
    }

    /**
     * Subject used to group events belonging to one account: the user id when
     * present, otherwise the email.
     *
     * @return the subject, or null if neither is present
     */
    public String subject() {
        if (userId != null && !userId.isBlank()) {
            return userId;
        }
        if (userEmail != null && !userEmail.isBlank()) {
            return userEmail;
        }
        return null;
    }
}
