package io.fantasymcp.mcp_gateway.api;

import io.fantasymcp.mcp_gateway.api.request.DiscoverSeasonsRequest;
import io.fantasymcp.mcp_gateway.api.response.DiscoverSeasonsResponse;
import io.fantasymcp.mcp_gateway.config.RequestMdcInterceptor;
import io.fantasymcp.mcp_gateway.model.SeasonDiscoveryResult;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.fantasymcp.mcp_gateway.service.StoreCallContext;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthentication;
import io.fantasymcp.mcp_gateway.service.auth.CallerAuthenticator;
import io.fantasymcp.mcp_gateway.service.discovery.SeasonDiscoveryReport;
import io.fantasymcp.mcp_gateway.service.discovery.SeasonDiscoveryService;
import io.fantasymcp.mcp_gateway.service.mcp.AuthChallenge;
import io.fantasymcp.mcp_gateway.service.mcp.AuthChallenges;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/onboarding")
@RequiredArgsConstructor
public class OnboardingController {

  static final String LIMIT_REACHED_MESSAGE =
      "League limit reached - some seasons may not have been saved";

  private final CallerAuthenticator callerAuthenticator;
  private final AuthChallenges authChallenges;
  private final SeasonDiscoveryService seasonDiscoveryService;
  private final GatewayMetrics gatewayMetrics;

  @PostMapping("/discover-seasons")
  public ResponseEntity<?> discoverSeasons(
      @RequestBody(required = false) DiscoverSeasonsRequest request,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      HttpServletRequest httpRequest) {
    final CallerAuthentication authentication =
        callerAuthenticator.authenticate(
            authorization, httpRequest.getHeader(callerAuthenticator.developmentUserHeader()));
    if (!authentication.isAuthenticated()) {
      final AuthChallenge challenge =
          authentication.outcome() == CallerAuthentication.Outcome.MISSING_CREDENTIALS
              ? AuthChallenge.UNAUTHORIZED
              : AuthChallenge.INVALID_TOKEN;
      gatewayMetrics.recordAuthChallenge(challenge.error());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .header(HttpHeaders.WWW_AUTHENTICATE, authChallenges.header(challenge))
          .body(new ApiErrorResponse("UNAUTHORIZED", challenge.message()));
    }

    final StoreCallContext context =
        new StoreCallContext(
            authentication.identity().subjectId(),
            authorization,
            RequestMdcInterceptor.correlationId(httpRequest));
    final SeasonDiscoveryReport report =
        seasonDiscoveryService.discover(
            request == null ? null : request.leagueId(),
            request == null ? null : request.sport(),
            context);
    final SeasonDiscoveryResult result = report.result();
    return ResponseEntity.ok(
        new DiscoverSeasonsResponse(
            true,
            report.leagueId(),
            report.sport().label(),
            result.startYear(),
            result.minYearReached(),
            result.rateLimited(),
            result.limitExceeded(),
            result.discovered(),
            result.skipped(),
            result.limitExceeded() ? LIMIT_REACHED_MESSAGE : null));
  }
}
