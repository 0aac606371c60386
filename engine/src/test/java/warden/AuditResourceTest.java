package warden;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;

import java.time.Duration;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.audit.AuditQuery;
import warden.core.service.audit.AuditLogger;

/**
 * Integration tests for the audit trail endpoints.
 */
@QuarkusTest
@DisplayName("Audit Resource Tests")
class AuditResourceTest {

    @Inject
    AuditLogger auditLogger;

    private void awaitPersisted(String userId) throws InterruptedException {
        for (var i = 0; i < 50; i++) {
            final var found = auditLogger.queryLogs(AuditQuery.forUser(userId)).await().atMost(Duration.ofSeconds(1));
            if (!found.isEmpty()) {
                return;
            }
            Thread.sleep(20);
        }
    }

    @Test
    @TestSecurity(user = "auditor", roles = "warden-admin")
    @DisplayName("should query entries by user and event type")
    void shouldQueryEntries() throws InterruptedException {
        auditLogger.logRoleAssignment("ops-query", "user-query", "member", "admin", "org-1");
        awaitPersisted("ops-query");

        given().queryParam("userId", "ops-query")
                .queryParam("eventType", "role_assigned")
                .when()
                .get("/admin/audit")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].riskLevel", equalTo("HIGH"))
                .body("[0].requiresReview", equalTo(true))
                .body("[0].metadata.kind", equalTo("role_change"));
    }

    @Test
    @TestSecurity(user = "auditor", roles = "warden-admin")
    @DisplayName("should reject unknown filter values")
    void shouldRejectUnknownFilter() {
        given().queryParam("riskLevel", "EXTREME")
                .when()
                .get("/admin/audit")
                .then()
                .statusCode(400)
                .body("title", equalTo("Validation Error"));
    }

    @Test
    @TestSecurity(user = "auditor", roles = "warden-admin")
    @DisplayName("should reject an unknown stats timeframe")
    void shouldRejectUnknownTimeframe() {
        given().queryParam("timeframe", "decade").when().get("/admin/audit/stats").then().statusCode(400);
    }

    @Test
    @TestSecurity(user = "auditor", roles = "warden-admin")
    @DisplayName("should count entries in the stats")
    void shouldReturnStats() throws InterruptedException {
        auditLogger.logPermissionCheck("stats-user", "billing:write", false, "missing_role", "org-1");
        awaitPersisted("stats-user");

        given().queryParam("timeframe", "week")
                .when()
                .get("/admin/audit/stats")
                .then()
                .statusCode(200)
                .body("timeframe", equalTo("WEEK"))
                .body("totalEvents", greaterThanOrEqualTo(1));
    }

    @Test
    @TestSecurity(user = "auditor", roles = "warden-admin")
    @DisplayName("should mark an entry reviewed and 404 unknown entries")
    void shouldReview() throws InterruptedException {
        final var entry = auditLogger.logRoleAssignment("ops-review", "user-review", null, "admin", "org-1");
        awaitPersisted("ops-review");

        given().contentType(ContentType.JSON)
                .body("""
                        {"notes": "approved change request"}
                        """)
                .when()
                .post("/admin/audit/" + entry.id() + "/review")
                .then()
                .statusCode(204);

        given().contentType(ContentType.JSON)
                .body("{}")
                .when()
                .post("/admin/audit/does-not-exist/review")
                .then()
                .statusCode(404);
    }

    @Test
    @TestSecurity(user = "auditor", roles = "warden-admin")
    @DisplayName("should report a healthy sink")
    void shouldReportSinkHealth() {
        given().when().get("/admin/audit/health").then().statusCode(200).body("status", equalTo("UP"));
    }
}
