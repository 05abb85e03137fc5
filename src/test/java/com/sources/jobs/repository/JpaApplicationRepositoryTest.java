package com.sources.jobs.repository;

import com.sources.jobs.model.Application;
import com.sources.jobs.model.ApplicationAuthentication;
import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.AvailabilityStatus;
import com.sources.jobs.model.DeletedResources;
import com.sources.jobs.model.RetryCandidate;
import com.sources.jobs.model.Source;
import com.sources.jobs.model.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.sources.jobs.repository.JpaTestSupport.application;
import static com.sources.jobs.repository.JpaTestSupport.authentication;
import static com.sources.jobs.repository.JpaTestSupport.count;
import static com.sources.jobs.repository.JpaTestSupport.link;
import static com.sources.jobs.repository.JpaTestSupport.reload;
import static com.sources.jobs.repository.JpaTestSupport.source;
import static com.sources.jobs.repository.JpaTestSupport.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JpaApplicationRepositoryTest {

    private static final int RETRY_MAX = 5;

    private JpaTransactions transactions;
    private JpaApplicationRepository repository;
    private LocalDateTime now;
    private Tenant tenant;
    private Source source;

    @BeforeEach
    void setUp() {
        transactions = JpaTestSupport.transactions();
        JpaTestSupport.clear(transactions);
        repository = new JpaApplicationRepository(transactions);
        now = LocalDateTime.now();
        tenant = tenant(transactions, "org-1");
        source = source(transactions, tenant, "aws");
    }

    @Test
    void claimPinsAvailableSelectsRecentUnavailableAndBumpsOnlySelected() {
        Application a = application(transactions, source, 1L, AvailabilityStatus.UNAVAILABLE, 2, now.minusMinutes(5));
        Application b = application(transactions, source, 1L, AvailabilityStatus.AVAILABLE, 1, now.minusMinutes(5));
        Application c = application(transactions, source, 1L, AvailabilityStatus.UNAVAILABLE, 0, now.minusHours(2));

        List<RetryCandidate> candidates = repository.claimRetryCandidates(RETRY_MAX, now.minusMinutes(30));

        assertThat(candidates).containsExactly(new RetryCandidate(a.getId(), 1L, tenant.getId()));
        assertThat(reload(transactions, a.getId()).getRetryCounter()).isEqualTo(3);
        assertThat(reload(transactions, b.getId()).getRetryCounter()).isEqualTo(RETRY_MAX);
        assertThat(reload(transactions, c.getId()).getRetryCounter()).isZero();
    }

    @Test
    void nullStatusCountsAsNotAvailable() {
        Application pending = application(transactions, source, 7L, null, 0, now.minusMinutes(1));

        List<RetryCandidate> candidates = repository.claimRetryCandidates(RETRY_MAX, now.minusMinutes(30));

        assertThat(candidates).extracting(RetryCandidate::applicationId).containsExactly(pending.getId());
        assertThat(reload(transactions, pending.getId()).getRetryCounter()).isEqualTo(1);
    }

    @Test
    void neverSelectsOrBumpsPastTheMaximum() {
        Application atMax = application(transactions, source, 1L, AvailabilityStatus.IN_PROGRESS, RETRY_MAX, now.minusMinutes(1));
        Application last = application(transactions, source, 1L, AvailabilityStatus.IN_PROGRESS, RETRY_MAX - 1, now.minusMinutes(1));

        assertThat(repository.claimRetryCandidates(RETRY_MAX, now.minusMinutes(30)))
                .extracting(RetryCandidate::applicationId)
                .containsExactly(last.getId());
        assertThat(repository.claimRetryCandidates(RETRY_MAX, now.minusMinutes(30))).isEmpty();

        assertThat(reload(transactions, atMax.getId()).getRetryCounter()).isEqualTo(RETRY_MAX);
        assertThat(reload(transactions, last.getId()).getRetryCounter()).isEqualTo(RETRY_MAX);
    }

    @Test
    void emptyClaimStillPinsAvailableApplications() {
        Application available = application(transactions, source, 1L, AvailabilityStatus.AVAILABLE, 0, now.minusMinutes(1));

        assertThat(repository.claimRetryCandidates(RETRY_MAX, now.minusMinutes(30))).isEmpty();
        assertThat(reload(transactions, available.getId()).getRetryCounter()).isEqualTo(RETRY_MAX);
    }

    @Test
    void findWithRelationsInitializesSourceTenantAndLinks() {
        Application application = application(transactions, source, 1L, null, 0, now);
        Authentication authentication = authentication(transactions, tenant, "Application", application.getId());
        link(transactions, application, authentication);

        Optional<Application> found = repository.findWithRelations(tenant.getId(), application.getId());

        assertThat(found).isPresent();
        assertThat(found.get().getSource().getName()).isEqualTo("aws");
        assertThat(found.get().getTenant().getOrgId()).isEqualTo("org-1");
        assertThat(found.get().getApplicationAuthentications())
                .extracting(link -> link.getAuthentication().getId())
                .containsExactly(authentication.getId());
    }

    @Test
    void findWithRelationsIsTenantScoped() {
        Application application = application(transactions, source, 1L, null, 0, now);
        Tenant other = tenant(transactions, "org-2");

        assertThat(repository.findWithRelations(other.getId(), application.getId())).isEmpty();
    }

    @Test
    void listIdsForSourceReturnsOldestFirst() {
        Application first = application(transactions, source, 1L, null, 0, now);
        Application second = application(transactions, source, 2L, null, 0, now);
        Source otherSource = source(transactions, tenant, "azure");
        application(transactions, otherSource, 1L, null, 0, now);

        assertThat(repository.listIdsForSource(tenant.getId(), source.getId()))
                .containsExactly(first.getId(), second.getId());
    }

    @Test
    void deleteCascadeRemovesLinksAndAuthenticationsOfTheApplication() {
        Application doomed = application(transactions, source, 1L, null, 0, now);
        Application survivor = application(transactions, source, 1L, null, 0, now);
        Authentication doomedAuth = authentication(transactions, tenant, "Application", doomed.getId());
        Authentication survivorAuth = authentication(transactions, tenant, "Application", survivor.getId());
        ApplicationAuthentication doomedLink = link(transactions, doomed, doomedAuth);
        link(transactions, survivor, survivorAuth);

        DeletedResources deleted = repository.deleteCascade(tenant.getId(), doomed.getId());

        assertThat(deleted.applications()).extracting(Application::getId).containsExactly(doomed.getId());
        assertThat(deleted.authentications()).extracting(Authentication::getId).containsExactly(doomedAuth.getId());
        assertThat(deleted.applicationAuthentications()).extracting(ApplicationAuthentication::getId)
                .containsExactly(doomedLink.getId());
        assertThat(deleted.source()).isNull();
        assertThat(count(transactions, Application.class)).isEqualTo(1);
        assertThat(count(transactions, Authentication.class)).isEqualTo(1);
        assertThat(count(transactions, ApplicationAuthentication.class)).isEqualTo(1);
    }

    @Test
    void deleteCascadeOfMissingApplicationThrowsNotFound() {
        assertThatThrownBy(() -> repository.deleteCascade(tenant.getId(), 999_999L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("999999");
    }
}
