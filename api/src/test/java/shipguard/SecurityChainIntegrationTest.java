package shipguard;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

import java.time.Clock;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shipguard.support.TestTokens;

/**
 * Exercises the security chain through the HTTP stack. Each test uses its own
 * forwarded client address so rate limit buckets do not leak between tests.
 */
@QuarkusTest
@DisplayName("Security Chain Integration Tests")
public class SecurityChainIntegrationTest {

    @Test
    @DisplayName("should accept a login failure report and attach security headers")
    void shouldAcceptLoginFailureReport() {
        given().header("X-Forwarded-For", "198.51.100.10")
                .contentType(ContentType.JSON)
                .body("{\"eventType\":\"login_failed\",\"email\":\"it@example.com\"}")
                .when()
                .post("/auth/events")
                .then()
                .statusCode(202)
                .header("X-Content-Type-Options", equalTo("nosniff"))
                .header("X-Correlation-ID", notNullValue())
                .body("sequence", notNullValue());
    }

    @Test
    @DisplayName("should reject an unknown auth event type")
    void shouldRejectUnknownAuthEventType() {
        given().header("X-Forwarded-For", "198.51.100.11")
                .contentType(ContentType.JSON)
                .body("{\"eventType\":\"password_reset\",\"email\":\"it@example.com\"}")
                .when()
                .post("/auth/events")
                .then()
                .statusCode(400);
    }

    @Test
    @DisplayName("should answer a problem document when the email is missing")
    void shouldRejectMissingEmail() {
        given().header("X-Forwarded-For", "198.51.100.16")
                .contentType(ContentType.JSON)
                .body("{\"eventType\":\"login_failed\"}")
                .when()
                .post("/auth/events")
                .then()
                .statusCode(400)
                .contentType("application/problem+json");
    }

    @Test
    @DisplayName("should require credentials for the audit endpoints")
    void shouldRequireCredentials() {
        given().header("X-Forwarded-For", "198.51.100.12")
                .when()
                .get("/admin/audit/events")
                .then()
                .statusCode(401);
    }

    @Test
    @DisplayName("should forbid audit access without the admin role")
    void shouldForbidNonAdmin() {
        final var token = TestTokens.token(Clock.systemUTC(), "u-7", "driver@example.com", "driver");

        given().header("X-Forwarded-For", "198.51.100.13")
                .header("Authorization", "Bearer " + token)
                .when()
                .get("/admin/audit/events")
                .then()
                .statusCode(403);
    }

    @Test
    @DisplayName("should serve audit events to an admin")
    void shouldServeAuditEventsToAdmin() {
        final var token = TestTokens.token(Clock.systemUTC(), "u-1", "admin@example.com", "admin");

        given().header("X-Forwarded-For", "198.51.100.14")
                .header("Authorization", "Bearer " + token)
                .when()
                .get("/admin/audit/events")
                .then()
                .statusCode(200)
                .contentType(ContentType.JSON);
    }

    @Test
    @DisplayName("should reject a negative result limit")
    void shouldRejectNegativeLimit() {
        final var token = TestTokens.token(Clock.systemUTC(), "u-1", "admin@example.com", "admin");

        given().header("X-Forwarded-For", "198.51.100.17")
                .header("Authorization", "Bearer " + token)
                .queryParam("limit", "-1")
                .when()
                .get("/admin/audit/events")
                .then()
                .statusCode(400);
    }

    @Test
    @DisplayName("should block injection in query parameters before authentication")
    void shouldBlockInjection() {
        given().header("X-Forwarded-For", "198.51.100.15")
                .queryParam("ip", "1 UNION SELECT 1")
                .when()
                .get("/admin/audit/events")
                .then()
                .statusCode(400);
    }
}
