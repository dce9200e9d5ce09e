package alpha.lapis.message;

import alpha.lapis.HttpConstants.HeaderName;

import static alpha.lapis.HttpConstants.ReasonPhrase.BAD_REQUEST;
import static alpha.lapis.HttpConstants.ReasonPhrase.ENTITY_TOO_LARGE;
import static alpha.lapis.HttpConstants.ReasonPhrase.HTTP_VERSION_NOT_SUPPORTED;
import static alpha.lapis.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.lapis.HttpConstants.ReasonPhrase.METHOD_NOT_ALLOWED;
import static alpha.lapis.HttpConstants.ReasonPhrase.NOT_FOUND;
import static alpha.lapis.HttpConstants.ReasonPhrase.NOT_IMPLEMENTED;
import static alpha.lapis.HttpConstants.ReasonPhrase.SERVICE_UNAVAILABLE;
import static alpha.lapis.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.lapis.HttpConstants.StatusCode.FIVE_HUNDRED_FIVE;
import static alpha.lapis.HttpConstants.StatusCode.FIVE_HUNDRED_ONE;
import static alpha.lapis.HttpConstants.StatusCode.FIVE_HUNDRED_THREE;
import static alpha.lapis.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.lapis.HttpConstants.StatusCode.FOUR_HUNDRED_FIVE;
import static alpha.lapis.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.lapis.HttpConstants.StatusCode.FOUR_HUNDRED_THIRTEEN;
import static alpha.lapis.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.lapis.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;

/**
 * Factories of {@link Response}s.<p>
 *
 * Responses without a body are cached; the same instance is returned each
 * time. Error responses carry their reason phrase as a plain text body, which
 * never leaks details of the failure.
 */
public final class Responses
{
    // Declaration of methods after status() follows ascending status-code order

    private static final String
            TEXT_PLAIN_UTF8       = "text/plain; charset=utf-8",
            APPLICATION_JSON_UTF8 = "application/json; charset=utf-8",
            TEXT_HTML_UTF8        = "text/html; charset=utf-8",
            OCTET_STREAM          = "application/octet-stream";

    private static final Response
            OK_EMPTY   = Response.builder(TWO_HUNDRED).build(),
            NO_CONTENT = Response.builder(TWO_HUNDRED_FOUR).build(),
            BAD_REQ    = error(FOUR_HUNDRED, BAD_REQUEST),
            NOT_FOUND_ = error(FOUR_HUNDRED_FOUR, NOT_FOUND),
            NOT_ALLOW  = error(FOUR_HUNDRED_FIVE, METHOD_NOT_ALLOWED),
            TOO_LARGE  = error(FOUR_HUNDRED_THIRTEEN, ENTITY_TOO_LARGE),
            ISE        = error(FIVE_HUNDRED, INTERNAL_SERVER_ERROR),
            NOT_IMPL   = error(FIVE_HUNDRED_ONE, NOT_IMPLEMENTED),
            UNAVAIL    = error(FIVE_HUNDRED_THREE, SERVICE_UNAVAILABLE),
            VERSION    = error(FIVE_HUNDRED_FIVE, HTTP_VERSION_NOT_SUPPORTED);

    private Responses() {
        // Empty
    }

    private static Response error(int code, String phrase) {
        return Response.builder(code, phrase)
                       .header(HeaderName.CONTENT_TYPE, TEXT_PLAIN_UTF8)
                       .body(phrase)
                       .build();
    }

    /**
     * Returns a response of the given status code, without headers or body.
     *
     * @param code status code
     * @return a response
     */
    public static Response status(int code) {
        return Response.builder(code).build();
    }

    /**
     * Returns a "200 OK" response without a body.
     *
     * @return a response
     */
    public static Response ok() {
        return OK_EMPTY;
    }

    /**
     * Returns a "200 OK" response with a body of type
     * "application/octet-stream".
     *
     * @param body of response
     * @return a response
     */
    public static Response ok(byte[] body) {
        return ok(body, OCTET_STREAM);
    }

    /**
     * Returns a "200 OK" response with a body of the given content type.
     *
     * @param body of response
     * @param contentType of body
     * @return a response
     */
    public static Response ok(byte[] body, String contentType) {
        return Response.builder(TWO_HUNDRED)
                       .header(HeaderName.CONTENT_TYPE, contentType)
                       .body(body)
                       .build();
    }

    /**
     * Returns a "200 OK" response with a body of type
     * "text/plain; charset=utf-8".
     *
     * @param textPlain body
     * @return a response
     */
    public static Response text(String textPlain) {
        return create(textPlain, TEXT_PLAIN_UTF8);
    }

    /**
     * Returns a "200 OK" response with a body of type
     * "text/html; charset=utf-8".
     *
     * @param textHtml body
     * @return a response
     */
    public static Response html(String textHtml) {
        return create(textHtml, TEXT_HTML_UTF8);
    }

    /**
     * Returns a "200 OK" response with a body of type
     * "application/json; charset=utf-8".<p>
     *
     * The library does not serialize objects; the given string must already
     * be JSON.
     *
     * @param json body
     * @return a response
     */
    public static Response json(String json) {
        return create(json, APPLICATION_JSON_UTF8);
    }

    private static Response create(String body, String contentType) {
        return Response.builder(TWO_HUNDRED)
                       .header(HeaderName.CONTENT_TYPE, contentType)
                       .body(body)
                       .build();
    }

    /**
     * Returns a "204 No Content" response.
     *
     * @return a response
     */
    public static Response noContent() {
        return NO_CONTENT;
    }

    /**
     * Returns a "400 Bad Request" response.
     *
     * @return a response
     */
    public static Response badRequest() {
        return BAD_REQ;
    }

    /**
     * Returns a "404 Not Found" response.
     *
     * @return a response
     */
    public static Response notFound() {
        return NOT_FOUND_;
    }

    /**
     * Returns a "405 Method Not Allowed" response.<p>
     *
     * The caller should add an {@code Allow} header.
     *
     * @return a response
     */
    public static Response methodNotAllowed() {
        return NOT_ALLOW;
    }

    /**
     * Returns a "413 Entity Too Large" response.
     *
     * @return a response
     */
    public static Response entityTooLarge() {
        return TOO_LARGE;
    }

    /**
     * Returns a "500 Internal Server Error" response.
     *
     * @return a response
     */
    public static Response internalServerError() {
        return ISE;
    }

    /**
     * Returns a "501 Not Implemented" response.
     *
     * @return a response
     */
    public static Response notImplemented() {
        return NOT_IMPL;
    }

    /**
     * Returns a "503 Service Unavailable" response.
     *
     * @return a response
     */
    public static Response serviceUnavailable() {
        return UNAVAIL;
    }

    /**
     * Returns a "505 HTTP Version Not Supported" response.
     *
     * @return a response
     */
    public static Response httpVersionNotSupported() {
        return VERSION;
    }
}
