package warden.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryIdentityStore;
import warden.core.config.BootstrapConfig;
import warden.core.model.auth.OrgRole;

/**
 * Creates the main organization and the admin user on startup.
 *
 * <p>The password is never logged. Startup fails if bootstrap is enabled without
 * an admin password.
 */
@ApplicationScoped
public class IdentityBootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(IdentityBootstrapInitializer.class);

    private final InMemoryIdentityStore identityStore;
    private final BootstrapConfig config;

    @Inject
    public IdentityBootstrapInitializer(InMemoryIdentityStore identityStore, BootstrapConfig config) {
        this.identityStore = identityStore;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        bootstrap();
    }

    void bootstrap() {
        if (!config.enabled()) {
            LOG.debug("Identity bootstrap is disabled");
            return;
        }
        final var password = config.adminPassword().filter(value -> !value.isBlank());
        if (password.isEmpty()) {
            LOG.error("Identity bootstrap is enabled but no admin password is set (warden.bootstrap.admin-password)");
            throw new IllegalStateException("Identity bootstrap is enabled but no admin password is set");
        }

        final var org = identityStore.createOrg(config.orgName());
        final var admin = identityStore.createUser(
                config.adminUser(), config.adminEmail().orElse(null), config.adminUser(), password.get());
        identityStore.addOrgMember(admin.id(), org.id(), OrgRole.ADMIN);
        LOG.infof("Bootstrapped org %d (%s) with admin user %s", org.id(), org.name(), admin.login());
    }
}
