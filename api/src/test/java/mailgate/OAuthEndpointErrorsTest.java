package mailgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Error responses of the authorization, token, registration and revocation endpoints.
 */
@QuarkusTest
@DisplayName("OAuth Endpoint Error Tests")
public class OAuthEndpointErrorsTest {

    private OAuthTestClient client;

    @BeforeEach
    void setUp() {
        client = OAuthTestClient.register();
    }

    @Nested
    @DisplayName("Authorization endpoint")
    class AuthorizationEndpoint {

        @Test
        @DisplayName("should answer an unknown client directly")
        void shouldRejectUnknownClient() {
            given().redirects()
                    .follow(false)
                    .queryParam("response_type", "code")
                    .queryParam("client_id", "does-not-exist")
                    .queryParam("code_challenge", OAuthTestClient.CHALLENGE)
                    .when()
                    .get("/authorize")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_request"))
                    .body("error_description", equalTo("Client ID 'does-not-exist' not found"));
        }

        @Test
        @DisplayName("should answer an unregistered redirect URI directly")
        void shouldRejectUnregisteredRedirect() {
            given().redirects()
                    .follow(false)
                    .queryParam("response_type", "code")
                    .queryParam("client_id", client.clientId)
                    .queryParam("redirect_uri", "https://attacker.example/cb")
                    .queryParam("code_challenge", OAuthTestClient.CHALLENGE)
                    .when()
                    .get("/authorize")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_request"));
        }

        @Test
        @DisplayName("should redirect invalid_scope back to the client")
        void shouldRedirectInvalidScope() {
            var location = given().redirects()
                    .follow(false)
                    .queryParam("response_type", "code")
                    .queryParam("client_id", client.clientId)
                    .queryParam("scope", "calendar.read")
                    .queryParam("state", "xyz")
                    .queryParam("code_challenge", OAuthTestClient.CHALLENGE)
                    .when()
                    .get("/authorize")
                    .then()
                    .statusCode(302)
                    .extract()
                    .header("Location");

            var params = OAuthTestClient.queryParams(location);
            assertEquals("invalid_scope", params.get("error"));
            assertEquals("xyz", params.get("state"));
        }

        @Test
        @DisplayName("should redirect a missing code_challenge back to the client")
        void shouldRedirectMissingChallenge() {
            var location = given().redirects()
                    .follow(false)
                    .queryParam("response_type", "code")
                    .queryParam("client_id", client.clientId)
                    .when()
                    .get("/authorize")
                    .then()
                    .statusCode(302)
                    .extract()
                    .header("Location");

            assertEquals("invalid_request", OAuthTestClient.queryParams(location).get("error"));
        }
    }

    @Nested
    @DisplayName("Token endpoint")
    class TokenEndpoint {

        @Test
        @DisplayName("should answer invalid_client with 401")
        void shouldRejectBadSecret() {
            given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "authorization_code")
                    .formParam("client_id", client.clientId)
                    .formParam("client_secret", "wrong")
                    .formParam("code", "x")
                    .formParam("code_verifier", OAuthTestClient.VERIFIER)
                    .when()
                    .post("/token")
                    .then()
                    .statusCode(401)
                    .header("Cache-Control", "no-store")
                    .body("error", equalTo("invalid_client"));
        }

        @Test
        @DisplayName("should reject unsupported grant types")
        void shouldRejectUnsupportedGrant() {
            given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "client_credentials")
                    .formParam("client_id", client.clientId)
                    .formParam("client_secret", client.clientSecret)
                    .when()
                    .post("/token")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("unsupported_grant_type"));
        }

        @Test
        @DisplayName("should reject a wrong code_verifier")
        void shouldRejectWrongVerifier() {
            var code = client.approve(client.authorize("mail.read", "s"));

            given().contentType(ContentType.URLENC)
                    .formParam("grant_type", "authorization_code")
                    .formParam("client_id", client.clientId)
                    .formParam("client_secret", client.clientSecret)
                    .formParam("code", code)
                    .formParam("redirect_uri", OAuthTestClient.REDIRECT_URI)
                    .formParam("code_verifier", "wrong-verifier-wrong-verifier-wrong-verifier")
                    .when()
                    .post("/token")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_grant"))
                    .body("error_description", equalTo("incorrect code_verifier"));
        }
    }

    @Nested
    @DisplayName("Registration endpoint")
    class RegistrationEndpoint {

        @Test
        @DisplayName("should reject a relative redirect URI")
        void shouldRejectRelativeRedirect() {
            given().contentType(ContentType.JSON)
                    .body("{\"redirect_uris\": [\"/cb\"]}")
                    .when()
                    .post("/register")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_redirect_uri"));
        }

        @Test
        @DisplayName("should reject scopes outside the valid set")
        void shouldRejectInvalidScope() {
            given().contentType(ContentType.JSON)
                    .body("{\"redirect_uris\": [\"https://cb.example/\"], \"scope\": \"admin\"}")
                    .when()
                    .post("/register")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_client_metadata"));
        }

        @Test
        @DisplayName("should assign default scopes and ignore unknown metadata")
        void shouldAssignDefaults() {
            given().contentType(ContentType.JSON)
                    .body("{\"redirect_uris\": [\"https://cb.example/\"], \"jwks_uri\": \"https://x\"}")
                    .when()
                    .post("/register")
                    .then()
                    .statusCode(201)
                    .header("Cache-Control", "no-store")
                    .body("scope", equalTo("mail.read"))
                    .body("client_secret_expires_at", equalTo(0))
                    .body("token_endpoint_auth_method", equalTo("client_secret_post"));
        }
    }

    @Nested
    @DisplayName("Revocation endpoint")
    class RevocationEndpoint {

        @Test
        @DisplayName("should answer 200 for an unknown token")
        void shouldIgnoreUnknownToken() {
            given().contentType(ContentType.URLENC)
                    .formParam("client_id", client.clientId)
                    .formParam("client_secret", client.clientSecret)
                    .formParam("token", "unknown")
                    .when()
                    .post("/revoke")
                    .then()
                    .statusCode(200);
        }

        @Test
        @DisplayName("should require client authentication")
        void shouldRequireAuthentication() {
            given().contentType(ContentType.URLENC)
                    .formParam("client_id", client.clientId)
                    .formParam("token", "unknown")
                    .when()
                    .post("/revoke")
                    .then()
                    .statusCode(401)
                    .body("error", equalTo("invalid_client"))
                    .body("error_description", containsString("secret"));
        }
    }
}
