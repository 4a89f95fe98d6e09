package de.htwsaar.offlinecache.cli.util;

import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

public final class HttpUtils {

    private HttpUtils() {}

    /**
     * Sendet einen Request und erfasst Statuscode und Antwort als String.
     * InterruptedException und IOException werden als {@link HttpCallResult#ioError} gemeldet.
     */
    public static HttpCallResult sendForStringBody(HttpClient httpClient, HttpRequest request) {
        Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(request, "request");

        try {
            HttpResponse<String> resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return HttpCallResult.http(resp.statusCode(), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpCallResult.ioError("interrupted");
        } catch (IOException e) {
            return HttpCallResult.ioError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}
