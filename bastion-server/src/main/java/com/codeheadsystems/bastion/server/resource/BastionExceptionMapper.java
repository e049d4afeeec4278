package com.codeheadsystems.bastion.server.resource;

import com.codeheadsystems.bastion.model.error.ErrorResponse;
import com.codeheadsystems.bastion.server.exception.AccessDeniedException;
import com.codeheadsystems.bastion.server.exception.AccountInactiveException;
import com.codeheadsystems.bastion.server.exception.AuthenticationFailedException;
import com.codeheadsystems.bastion.server.exception.BastionException;
import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.bastion.server.exception.StoreUnavailableException;
import com.codeheadsystems.bastion.server.exception.TokenExpiredException;
import com.codeheadsystems.bastion.server.exception.TokenInvalidException;
import com.codeheadsystems.bastion.server.exception.TokenVerificationException;
import com.codeheadsystems.bastion.server.exception.ValidationFailedException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps core failures to JSON {@link ErrorResponse} bodies.
 * <p>
 * Messages come from a fixed vocabulary: nothing here echoes key material, token contents or
 * stack traces, and a failed login never reveals whether the username exists.
 */
@Provider
public class BastionExceptionMapper implements ExceptionMapper<BastionException> {

  private static final Logger log = LoggerFactory.getLogger(BastionExceptionMapper.class);

  @Override
  public Response toResponse(BastionException exception) {
    if (exception instanceof ValidationFailedException e) {
      return build(Response.Status.BAD_REQUEST,
          new ErrorResponse("invalid_request", "Validation failed", e.getViolations()));
    }
    if (exception instanceof DuplicateHandleException || exception instanceof DuplicateAddressException) {
      return build(Response.Status.CONFLICT, new ErrorResponse("conflict", exception.getMessage()));
    }
    if (exception instanceof AuthenticationFailedException) {
      return unauthorized(new ErrorResponse("invalid_grant", exception.getMessage()));
    }
    if (exception instanceof AccountInactiveException) {
      return unauthorized(new ErrorResponse("account_inactive", exception.getMessage()));
    }
    if (exception instanceof TokenExpiredException) {
      return unauthorized(new ErrorResponse("token_expired", "Token has expired"));
    }
    if (exception instanceof TokenInvalidException || exception instanceof TokenVerificationException) {
      return unauthorized(new ErrorResponse("invalid_token", "Could not validate credentials"));
    }
    if (exception instanceof AccessDeniedException) {
      return build(Response.Status.FORBIDDEN, new ErrorResponse("access_denied", exception.getMessage()));
    }
    if (exception instanceof PrincipalNotFoundException) {
      return build(Response.Status.NOT_FOUND, new ErrorResponse("not_found", exception.getMessage()));
    }
    if (exception instanceof StoreUnavailableException) {
      log.error("Credential store unavailable", exception);
      return build(Response.Status.SERVICE_UNAVAILABLE,
          new ErrorResponse("temporarily_unavailable", "Service temporarily unavailable"));
    }
    log.error("Unhandled core failure", exception);
    return build(Response.Status.INTERNAL_SERVER_ERROR,
        new ErrorResponse("server_error", "Internal server error"));
  }

  private static Response unauthorized(ErrorResponse body) {
    return Response.status(Response.Status.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(body)
        .build();
  }

  private static Response build(Response.Status status, ErrorResponse body) {
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(body)
        .build();
  }
}
