package alpha.nomagicdispatch.handler;

import alpha.nomagicdispatch.Server;
import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.Response;

/**
 * Application code invoked once per request.<p>
 * 
 * A handler is installed using {@link Server#around(Handler)}. The server
 * shares one handler instance between all concurrently executing requests,
 * and so the handler must be thread-safe.<p>
 * 
 * The handler is free to block. Each request executes on its own worker
 * thread and the handler's completion is what the server waits for before
 * writing the response.<p>
 * 
 * Any exception thrown by the handler, and a {@code null} return value, are
 * treated the same way: the error is logged together with the request, and
 * a "500 Internal Server Error" response is written to the client. Exception
 * types are not mapped to other status codes; a handler that wants to
 * respond with a specific error status must return that response itself.
 * 
 * <pre>{@code
 *   Handler h = req -> req.target().path().equals("/greet") ?
 *           Responses.text("Hello") : Responses.notFound();
 * }</pre>
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Handles a request.
     * 
     * @param request the request (never {@code null})
     * 
     * @return the response (should not be {@code null})
     * 
     * @throws Exception for any reason
     */
    Response call(Request request) throws Exception;
}
