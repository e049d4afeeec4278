package com.codeheadsystems.bastion.server.resource;

import com.codeheadsystems.bastion.model.user.PrincipalResponse;
import com.codeheadsystems.bastion.model.user.RegisterRequest;
import com.codeheadsystems.bastion.server.dispatch.RequestDispatcher;
import com.codeheadsystems.bastion.server.dispatch.command.GrantRoleCommand;
import com.codeheadsystems.bastion.server.dispatch.command.ListPrincipalsCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RegisterCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RevokeRoleCommand;
import com.codeheadsystems.bastion.server.dispatch.command.SetActiveCommand;
import com.codeheadsystems.bastion.server.dispatch.command.UserInfoCommand;
import com.codeheadsystems.bastion.server.exception.ValidationFailedException;
import com.codeheadsystems.bastion.server.model.Principal;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for registration and principal management.
 * <p>
 * Registration is public and may not self-assign {@code admin}. Everything under
 * {@code /{id}} and the listing require a bearer access token of an admin.
 */
@Singleton
@Path("/api/v1/users")
@Produces(MediaType.APPLICATION_JSON)
public class UserResource {

  private static final Logger log = LoggerFactory.getLogger(UserResource.class);

  private final RequestDispatcher dispatcher;

  @Inject
  public UserResource(RequestDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @POST
  @Path("/register")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response register(RegisterRequest request) {
    log.debug("register()");
    if (request == null) {
      throw new ValidationFailedException(List.of("Request body is required"));
    }
    if (request.roles() != null && request.roles().contains(Principal.ROLE_ADMIN)) {
      throw new ValidationFailedException(List.of("Role admin cannot be self-assigned"));
    }
    Principal created = dispatcher.dispatch(new RegisterCommand(
        request.username(), request.email(), request.password(), request.roles()));
    return Response.status(Response.Status.CREATED).entity(Views.principal(created)).build();
  }

  @GET
  @Path("/me")
  public PrincipalResponse me(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return Views.principal(
        dispatcher.dispatch(new UserInfoCommand(BearerTokens.extract(authorization))));
  }

  @GET
  public List<PrincipalResponse> list(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return Views.principals(
        dispatcher.dispatch(new ListPrincipalsCommand(BearerTokens.extract(authorization))));
  }

  @POST
  @Path("/{id}/activate")
  public PrincipalResponse activate(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                    @PathParam("id") String id) {
    return Views.principal(dispatcher.dispatch(
        new SetActiveCommand(BearerTokens.extract(authorization), id, true)));
  }

  @POST
  @Path("/{id}/deactivate")
  public PrincipalResponse deactivate(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                      @PathParam("id") String id) {
    return Views.principal(dispatcher.dispatch(
        new SetActiveCommand(BearerTokens.extract(authorization), id, false)));
  }

  @PUT
  @Path("/{id}/roles/{role}")
  public PrincipalResponse grantRole(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                     @PathParam("id") String id,
                                     @PathParam("role") String role) {
    return Views.principal(dispatcher.dispatch(
        new GrantRoleCommand(BearerTokens.extract(authorization), id, role)));
  }

  @DELETE
  @Path("/{id}/roles/{role}")
  public PrincipalResponse revokeRole(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                      @PathParam("id") String id,
                                      @PathParam("role") String role) {
    return Views.principal(dispatcher.dispatch(
        new RevokeRoleCommand(BearerTokens.extract(authorization), id, role)));
  }
}
