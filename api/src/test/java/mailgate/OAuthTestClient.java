package mailgate;

import static io.restassured.RestAssured.given;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import io.restassured.http.ContentType;

/**
 * Drives the authorization code flow over HTTP for integration tests.
 */
final class OAuthTestClient {

    static final String PASSWORD = "correct-horse";
    static final String REDIRECT_URI = "https://client.example/cb";
    static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
    static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

    final String clientId;
    final String clientSecret;

    private OAuthTestClient(String clientId, String clientSecret) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    /**
     * Register a confidential client allowed mail.read and mail.send.
     */
    static OAuthTestClient register() {
        var response = given().contentType(ContentType.JSON)
                .body("""
                        {
                          "redirect_uris": ["%s"],
                          "client_name": "Integration Test Client",
                          "scope": "mail.read mail.send"
                        }
                        """.formatted(REDIRECT_URI))
                .when()
                .post("/register")
                .then()
                .statusCode(201)
                .extract();
        return new OAuthTestClient(response.path("client_id"), response.path("client_secret"));
    }

    /**
     * Start an authorization request and return the consent transaction id.
     */
    String authorize(String scope, String state) {
        var location = given().redirects()
                .follow(false)
                .queryParam("response_type", "code")
                .queryParam("client_id", clientId)
                .queryParam("redirect_uri", REDIRECT_URI)
                .queryParam("scope", scope)
                .queryParam("state", state)
                .queryParam("code_challenge", CHALLENGE)
                .queryParam("code_challenge_method", "S256")
                .when()
                .get("/authorize")
                .then()
                .statusCode(302)
                .extract()
                .header("Location");
        return queryParams(location).get("tx");
    }

    /**
     * Approve a transaction and return the authorization code.
     */
    String approve(String tx) {
        var location = given().redirects()
                .follow(false)
                .contentType(ContentType.URLENC)
                .formParam("tx", tx)
                .formParam("password", PASSWORD)
                .formParam("action", "approve")
                .when()
                .post("/oauth/consent")
                .then()
                .statusCode(302)
                .extract()
                .header("Location");
        return queryParams(location).get("code");
    }

    /**
     * Run the whole flow and return the token response body as a map.
     */
    Map<String, Object> obtainTokens(String scope) {
        var code = approve(authorize(scope, "s"));
        return given().contentType(ContentType.URLENC)
                .formParam("grant_type", "authorization_code")
                .formParam("client_id", clientId)
                .formParam("client_secret", clientSecret)
                .formParam("code", code)
                .formParam("redirect_uri", REDIRECT_URI)
                .formParam("code_verifier", VERIFIER)
                .when()
                .post("/token")
                .then()
                .statusCode(200)
                .extract()
                .jsonPath()
                .getMap("$");
    }

    static Map<String, String> queryParams(String location) {
        var params = new LinkedHashMap<String, String>();
        var query = URI.create(location).getRawQuery();
        if (query == null) {
            return params;
        }
        for (String pair : query.split("&")) {
            var separator = pair.indexOf('=');
            var name = separator < 0 ? pair : pair.substring(0, separator);
            var value = separator < 0 ? "" : pair.substring(separator + 1);
            params.put(
                    URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }
}
