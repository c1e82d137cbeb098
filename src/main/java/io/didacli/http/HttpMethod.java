package io.didacli.http;

public enum HttpMethod {
    GET,
    POST,
    DELETE
}
