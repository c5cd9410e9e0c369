package com.subscription.api.problem;

import java.net.URI;

/**
 * RFC 7807 problem type URIs returned by the REST API.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://subscriptions.example.com/docs/errors";

    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI SELF_SUBSCRIPTION = URI.create(BASE_URL + "/self-subscription");

    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    public static final URI SUBSCRIPTION_CONFLICT = URI.create(BASE_URL + "/subscription-conflict");
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    public static final URI IDENTITY_SERVICE_UNAVAILABLE = URI.create(BASE_URL + "/identity-service-unavailable");
    public static final URI IDENTITY_SERVICE_ERROR = URI.create(BASE_URL + "/identity-service-error");

    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
