package shipguard.adapter.in.http;

import java.util.Optional;

import jakarta.enterprise.context.RequestScoped;

import shipguard.core.model.audit.NetworkOrigin;
import shipguard.core.model.audit.UserIdentity;
import shipguard.core.model.auth.AuthenticatedPrincipal;
import shipguard.core.model.chain.SecurityRequest;

/**
 * Request-scoped holder for the chain's view of the current request, so
 * resources can read the verified principal and client origin.
 */
@RequestScoped
public class CurrentSecurityRequest {

    private SecurityRequest request;

    void set(SecurityRequest request) {
        this.request = request;
    }

    public Optional<SecurityRequest> get() {
        return Optional.ofNullable(request);
    }

    public Optional<UserIdentity> identity() {
        return get().flatMap(SecurityRequest::principal).map(AuthenticatedPrincipal::toIdentity);
    }

    public NetworkOrigin origin() {
        return get().map(SecurityRequest::origin).orElse(NetworkOrigin.ofIp(ClientIpResolver.UNKNOWN));
    }

    public String correlationId() {
        return get().map(SecurityRequest::correlationId).orElse(null);
    }
}
