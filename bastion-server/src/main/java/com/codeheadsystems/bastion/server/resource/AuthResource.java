package com.codeheadsystems.bastion.server.resource;

import com.codeheadsystems.bastion.model.token.IntrospectionResponse;
import com.codeheadsystems.bastion.model.token.RefreshTokenRequest;
import com.codeheadsystems.bastion.model.token.TokenResponse;
import com.codeheadsystems.bastion.model.user.PrincipalResponse;
import com.codeheadsystems.bastion.server.dispatch.RequestDispatcher;
import com.codeheadsystems.bastion.server.dispatch.command.IntrospectCommand;
import com.codeheadsystems.bastion.server.dispatch.command.LoginCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RefreshCommand;
import com.codeheadsystems.bastion.server.dispatch.command.UserInfoCommand;
import com.codeheadsystems.bastion.server.exception.ValidationFailedException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the token endpoints.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/auth/token}: password or refresh_token grant (form encoded)</li>
 *   <li>{@code POST /api/v1/auth/refresh}: refresh exchange (JSON)</li>
 *   <li>{@code POST /api/v1/auth/introspect}: token introspection (form encoded)</li>
 *   <li>{@code GET /api/v1/auth/userinfo}: principal behind the bearer access token</li>
 * </ul>
 * Failures surface as core exceptions and are rendered by {@link BastionExceptionMapper}.
 */
@Singleton
@Path("/api/v1/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  static final String GRANT_PASSWORD = "password";
  static final String GRANT_REFRESH_TOKEN = "refresh_token";

  private final RequestDispatcher dispatcher;

  @Inject
  public AuthResource(RequestDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  /**
   * Token endpoint. {@code grant_type=password} requires {@code username} and
   * {@code password}; {@code grant_type=refresh_token} requires {@code refresh_token}.
   */
  @POST
  @Path("/token")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  public TokenResponse token(@FormParam("grant_type") String grantType,
                             @FormParam("username") String username,
                             @FormParam("password") String password,
                             @FormParam("refresh_token") String refreshToken) {
    log.debug("token(grant_type={})", grantType);
    String grant = grantType == null || grantType.isBlank() ? GRANT_PASSWORD : grantType;
    return switch (grant) {
      case GRANT_PASSWORD -> {
        requirePresent(username, "username");
        requirePresent(password, "password");
        yield Views.tokens(dispatcher.dispatch(new LoginCommand(username, password)));
      }
      case GRANT_REFRESH_TOKEN -> {
        requirePresent(refreshToken, "refresh_token");
        yield Views.tokens(dispatcher.dispatch(new RefreshCommand(refreshToken)));
      }
      default -> throw new ValidationFailedException(List.of("Unsupported grant_type: " + grant));
    };
  }

  /**
   * Refresh exchange with a JSON body. Returns a new access token and the same refresh token.
   */
  @POST
  @Path("/refresh")
  @Consumes(MediaType.APPLICATION_JSON)
  public TokenResponse refresh(RefreshTokenRequest request) {
    log.debug("refresh()");
    requirePresent(request == null ? null : request.refreshToken(), "refresh_token");
    return Views.tokens(dispatcher.dispatch(new RefreshCommand(request.refreshToken())));
  }

  /**
   * Introspection. Never fails for a bad token; reports {@code active=false} instead.
   */
  @POST
  @Path("/introspect")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  public IntrospectionResponse introspect(@FormParam("token") String token) {
    log.debug("introspect()");
    if (token == null || token.isBlank()) {
      return IntrospectionResponse.inactive();
    }
    return dispatcher.dispatch(new IntrospectCommand(token))
        .map(Views::introspection)
        .orElseGet(IntrospectionResponse::inactive);
  }

  @GET
  @Path("/userinfo")
  public PrincipalResponse userInfo(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return Views.principal(
        dispatcher.dispatch(new UserInfoCommand(BearerTokens.extract(authorization))));
  }

  private static void requirePresent(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationFailedException(List.of("Missing required field: " + field));
    }
  }
}
