package vn.com.fecredit.filestore.tenant;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import vn.com.fecredit.filestore.config.FileStoreProperties;
import vn.com.fecredit.filestore.util.FileNameValidator;

import java.security.Principal;

/**
 * Determines which tenant a request acts for: the authenticated principal if
 * there is one, then the configured tenant header, then the default tenant.
 */
@Component
public class TenantResolver {

    private final FileStoreProperties properties;

    public TenantResolver(FileStoreProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws IllegalArgumentException if the tenant id cannot name a storage directory
     */
    public String resolve(Principal principal, HttpServletRequest request) {
        String tenant;
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            tenant = principal.getName();
        } else {
            String header = request.getHeader(properties.getTenantHeader());
            tenant = header != null && !header.isBlank() ? header.trim() : properties.getDefaultTenant();
        }
        FileNameValidator.requireValid(tenant, "tenant id");
        if (tenant.startsWith(".")) {
            throw new IllegalArgumentException("Invalid tenant id: " + tenant);
        }
        return tenant;
    }
}
