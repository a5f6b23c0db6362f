package at.sv.astro.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.net.URL;

@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    private final OkHttpClient httpClient;

    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * @return a client that identifies itself with the given user agent, as required by public endpoints such as
     * Nominatim
     */
    public static OkHttpClient createHttpClient(String userAgent) {
        return new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request request = chain.request().newBuilder()
                                           .header("User-Agent", userAgent)
                                           .build();
                    return chain.proceed(request);
                })
                .build();
    }

    @Override
    public String getResource(URL url) {
        log.trace("Get: {}", url);
        Request request = new Request.Builder()
                .url(url)
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            assertSuccessful(response);
            return getBody(response);
        } catch (IOException e) {
            log.error("Failed '{}'", request);
            throw new ApiConnectionFailure("Failed '" + request + "'", e);
        }
    }

    private static void assertSuccessful(Response response) throws IOException {
        if (response.code() == 404) {
            throw new ResourceNotFoundException("Resource not found: " + getBody(response));
        }
        if (response.code() == 429) {
            throw new ApiFailure("Rate limit exceeded: " + getBody(response));
        }
        if (response.code() >= 500) {
            throw new ApiFailure("Server error: " + getBody(response));
        }
        if (!response.isSuccessful()) {
            throw new IOException("Unexpected return code " + response + ". " + getBody(response));
        }
    }

    private static String getBody(Response response) throws IOException {
        return response.body().string();
    }
}
