package orbit.manager.client.http;

import orbit.manager.client.ManagerApiException;
import orbit.manager.client.ManagerClient;
import orbit.manager.client.ManagerConnector;
import orbit.manager.config.ManagerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Locale;

/**
 * Opens cookie-held sessions against the manager REST API.
 *
 * Login is a form post to {@code /j_security_check}; the manager answers a rejected login
 * with its HTML login page instead of an error status. The XSRF token from
 * {@code /dataservice/client/token} is sent on every subsequent request.
 */
public class HttpManagerConnector implements ManagerConnector {

    private static final Logger log = LoggerFactory.getLogger(HttpManagerConnector.class);

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    @Override
    public ManagerClient connect(ManagerEndpoint endpoint) throws IOException, InterruptedException {
        HttpClient http = newHttpClient(endpoint);
        String baseUrl = endpoint.baseUrl();

        log.debug("Logging in to {} as '{}'", baseUrl, endpoint.username());

        String form = "j_username=" + encode(endpoint.username()) + "&j_password=" + encode(endpoint.password());
        HttpRequest login = HttpRequest.newBuilder(URI.create(baseUrl + "/j_security_check"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> loginResponse = http.send(login, HttpResponse.BodyHandlers.ofString());

        if (loginResponse.statusCode() >= 400) {
            throw ManagerApiException.ofStatus("POST", "/j_security_check", loginResponse.statusCode(),
                    loginResponse.body());
        }
        if (isLoginPage(loginResponse.body())) {
            throw new ManagerApiException(401, null, "Login rejected: unauthorized");
        }

        HttpRequest tokenRequest = HttpRequest.newBuilder(URI.create(baseUrl + "/dataservice/client/token"))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        HttpResponse<String> tokenResponse = http.send(tokenRequest, HttpResponse.BodyHandlers.ofString());

        String token = null;
        if (tokenResponse.statusCode() == 200 && !tokenResponse.body().isBlank()) {
            token = tokenResponse.body().trim();
        } else {
            log.debug("No XSRF token available (status {})", tokenResponse.statusCode());
        }

        log.info("Connected to manager {}", baseUrl);
        return new HttpManagerClient(http, baseUrl, token);
    }

    static boolean isLoginPage(String body) {
        return body != null && body.toLowerCase(Locale.ROOT).contains("<html");
    }

    private static HttpClient newHttpClient(ManagerEndpoint endpoint) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(CONNECT_TIMEOUT)
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NEVER);

        if (!endpoint.verify() && endpoint.url().startsWith("https://")) {
            builder.sslContext(trustAllContext());
        }
        return builder.build();
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot initialize TLS context", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
