package com.codeheadsystems.bastion.server.resource;

import com.codeheadsystems.bastion.model.token.IntrospectionResponse;
import com.codeheadsystems.bastion.model.token.TokenResponse;
import com.codeheadsystems.bastion.model.user.PrincipalResponse;
import com.codeheadsystems.bastion.server.model.Principal;
import com.codeheadsystems.bastion.server.token.TokenClaims;
import com.codeheadsystems.bastion.server.token.TokenPair;
import java.util.List;

/**
 * Conversions from core types to wire DTOs. The password hash never crosses this boundary.
 */
final class Views {

  private Views() {
  }

  static PrincipalResponse principal(Principal principal) {
    return new PrincipalResponse(principal.id(), principal.username(), principal.email(),
        List.copyOf(principal.roles()), principal.active());
  }

  static List<PrincipalResponse> principals(List<Principal> principals) {
    return principals.stream().map(Views::principal).toList();
  }

  static TokenResponse tokens(TokenPair pair) {
    return new TokenResponse(pair.accessToken(), pair.refreshToken(), pair.expiresInSeconds());
  }

  static IntrospectionResponse introspection(TokenClaims claims) {
    return new IntrospectionResponse(true,
        claims.subject(),
        claims.username(),
        claims.email(),
        claims.roles().isEmpty() ? null : claims.roles(),
        claims.kind().claimValue(),
        claims.expiresAt().getEpochSecond(),
        claims.issuedAt().getEpochSecond());
  }
}
