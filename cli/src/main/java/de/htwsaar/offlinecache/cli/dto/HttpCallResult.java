package de.htwsaar.offlinecache.cli.dto;

/**
 * Ergebnis eines HTTP-Aufrufs gegen den Worker: Statuscode und Body, oder eine I/O-Fehlermeldung.
 */
public record HttpCallResult(Integer statusCode, String body, String error) {

    public static HttpCallResult http(int statusCode, String body) {
        return new HttpCallResult(statusCode, body, null);
    }

    public static HttpCallResult ioError(String message) {
        return new HttpCallResult(null, null, message == null ? "io error" : message);
    }

    public boolean is2xx() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }

    public boolean isIoError() {
        return statusCode == null;
    }
}
