package com.codeheadsystems.swapdot.server.resource;

import com.codeheadsystems.swapdot.desfire.MalformedFrameException;
import com.codeheadsystems.swapdot.desfire.WeakKeyException;
import com.codeheadsystems.swapdot.model.ErrorResponse;
import com.codeheadsystems.swapdot.server.exception.ErrorKind;
import com.codeheadsystems.swapdot.server.exception.SwapDotException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps domain failures to status codes with an {@link ErrorResponse} body. Internal failures
 * are logged and returned without detail.
 */
@Provider
public class SwapDotExceptionMapper implements ExceptionMapper<RuntimeException> {

  private static final Logger log = LoggerFactory.getLogger(SwapDotExceptionMapper.class);

  /** Not defined in {@link Response.Status}. */
  static final int PRECONDITION_FAILED_WEAK_KEY = 412;

  @Override
  public Response toResponse(RuntimeException exception) {
    if (exception instanceof WebApplicationException wae) {
      return wae.getResponse();
    }
    if (exception instanceof SwapDotException e) {
      return fromKind(e.kind(), e);
    }
    if (exception instanceof WeakKeyException e) {
      return fromKind(ErrorKind.WEAK_KEY, e);
    }
    if (exception instanceof MalformedFrameException e) {
      return fromKind(ErrorKind.PROTOCOL, e);
    }
    if (exception instanceof IllegalArgumentException e) {
      return fromKind(ErrorKind.INVALID_ARGUMENT, e);
    }
    if (exception instanceof IllegalStateException e) {
      log.warn("Service unavailable: {}", e.getMessage());
      return build(Response.Status.SERVICE_UNAVAILABLE.getStatusCode(), "UNAVAILABLE", e.getMessage());
    }
    return fromKind(ErrorKind.INTERNAL, exception);
  }

  static int status(ErrorKind kind) {
    return switch (kind) {
      case INVALID_ARGUMENT -> Response.Status.BAD_REQUEST.getStatusCode();
      case PERMISSION, PROTOCOL -> Response.Status.FORBIDDEN.getStatusCode();
      case NOT_FOUND -> Response.Status.NOT_FOUND.getStatusCode();
      case CONFLICT -> Response.Status.CONFLICT.getStatusCode();
      case EXPIRED -> Response.Status.GONE.getStatusCode();
      case WEAK_KEY -> PRECONDITION_FAILED_WEAK_KEY;
      case INTERNAL -> Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
    };
  }

  private static Response fromKind(ErrorKind kind, RuntimeException e) {
    if (kind == ErrorKind.INTERNAL) {
      log.error("Internal error", e);
      return build(status(kind), kind.name(), "Internal error");
    }
    log.debug("{}: {}", kind, e.getMessage());
    return build(status(kind), kind.name(), e.getMessage());
  }

  private static Response build(int status, String kind, String message) {
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(kind, message))
        .build();
  }
}
