package shipguard.adapter.in.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Login outcome reported by the login page.
 *
 * @param eventType {@code login_success} or {@code login_failed}
 * @param email the account email
 * @param userId the user id, when known
 * @param reason failure reason, for failed logins
 */
public record AuthEventRequest(
        @NotNull(message = "eventType is required")
                @Pattern(
                        regexp = "login_success|login_failed",
                        message = "eventType must be login_success or login_failed")
                String eventType,
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") String email,
        @Size(max = 128, message = "userId must be at most 128 characters") String userId,
        @Size(max = 256, message = "reason must be at most 256 characters") String reason) {}
