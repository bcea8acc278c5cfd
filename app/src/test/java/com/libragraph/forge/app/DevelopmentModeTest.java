package com.libragraph.forge.app;

import com.libragraph.forge.core.lifecycle.LifecycleSupervisor;
import com.libragraph.forge.core.status.Outcome;
import com.libragraph.forge.core.status.StatusRegister;
import com.libragraph.forge.core.system.SystemMap;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class DevelopmentModeTest {

    @Inject
    LifecycleSupervisor supervisor;

    @Inject
    StatusRegister statusRegister;

    @AfterEach
    void tearDown() {
        supervisor.stop();
    }

    @Test
    void htmlPagesGetRefreshScript() {
        supervisor.reset();

        given()
                .accept(ContentType.HTML)
                .when().get("/")
                .then()
                .statusCode(200)
                .contentType(containsString("text/html"))
                .body(containsString("<li>ticker</li>"))
                .body(containsString("<script>"))
                .body(containsString("/api/status/next"));
    }

    @Test
    void jsonResponsesAreLeftAlone() {
        given()
                .when().get("/api/status")
                .then()
                .statusCode(200)
                .body(not(containsString("<script>")));
    }

    @Test
    void applicationRequestsFailWhileUnhealthy() {
        statusRegister.set(Outcome.unhealthy(new IllegalStateException("database unreachable"), SystemMap.empty()));

        String page = given()
                .accept(ContentType.HTML)
                .when().get("/")
                .then()
                .statusCode(500)
                .contentType(containsString("text/html"))
                .body(containsString("Error Stacktrace"))
                .body(containsString("database unreachable"))
                .extract().asString();
        assertThat(page).containsOnlyOnce("fetch('/api/status/next')");

        given()
                .accept(ContentType.JSON)
                .when().get("/")
                .then()
                .statusCode(500)
                .body("error", is("java.lang.IllegalStateException"))
                .body("message", is("database unreachable"));
    }

    @Test
    void forgeEndpointsStayReachableWhileUnhealthy() {
        statusRegister.set(Outcome.unhealthy(new IllegalStateException("database unreachable"), SystemMap.empty()));

        given()
                .when().get("/api/status")
                .then()
                .statusCode(200)
                .body("state", is("UNHEALTHY"));

        given()
                .when().post("/api/system/reset")
                .then()
                .statusCode(200)
                .body("state", is("HEALTHY"));
    }

    @Test
    void unhandledExceptionRendersEscapedErrorPage() {
        String page = given()
                .accept(ContentType.HTML)
                .when().get("/test/fail")
                .then()
                .statusCode(500)
                .contentType(containsString("text/html"))
                .body(containsString("java.lang.IllegalStateException: kaboom &lt;b&gt;"))
                .body(containsString("FailingResource.fail"))
                .extract().asString();
        assertThat(page).containsOnlyOnce("fetch('/api/status/next')");
    }

    @Test
    void unhandledExceptionAsJson() {
        given()
                .accept(ContentType.JSON)
                .when().get("/test/fail")
                .then()
                .statusCode(500)
                .body("error", is("java.lang.IllegalStateException"))
                .body("message", is("kaboom <b>"));
    }

    @Test
    void unknownPathIsNotFound() {
        given()
                .accept(ContentType.JSON)
                .when().get("/no/such/page")
                .then()
                .statusCode(404);
    }
}
