package com.authgate.backend.twofactor.store;

import com.authgate.backend.auth.entity.User;
import com.authgate.backend.auth.repo.UserRepo;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.config.PropertiesConfig;
import com.authgate.backend.testsupport.BaseSpringTest;
import com.authgate.backend.twofactor.entity.MagicLink;
import com.authgate.backend.twofactor.repo.MagicLinkRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaMagicLinkStore.class, PropertiesConfig.class})
@TestPropertySource(properties = "spring.datasource.url=jdbc:h2:mem:magiclinks;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaMagicLinkStoreTest extends BaseSpringTest {

    @Autowired JpaMagicLinkStore store;
    @Autowired MagicLinkRepository repo;
    @Autowired UserRepo userRepo;

    private final Instant t0 = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    private long userId;

    @BeforeEach
    void seedUser() {
        User u = new User();
        u.setEmail("a@x.com");
        u.setUsername("alice");
        u.setPasswordHash("hash");
        userId = userRepo.saveAndFlush(u).getId();
    }

    @AfterEach
    void cleanup() {
        repo.deleteAllInBatch();
        userRepo.deleteAllInBatch();
    }

    @Test
    void fourthActiveLink_evictsOldest() {
        MagicLink first = store.create(link("h1", t0));
        store.create(link("h2", t0.plusSeconds(1)));
        store.create(link("h3", t0.plusSeconds(2)));
        store.create(link("h4", t0.plusSeconds(3)));

        List<MagicLink> active = store.listActiveByUser(userId, t0.plusSeconds(4));
        assertThat(active).extracting(MagicLink::getTokenHash).containsExactly("h2", "h3", "h4");
        assertThat(repo.findById(first.getId())).isEmpty();
    }

    @Test
    void usedAndExpiredLinks_doNotCountTowardsCap() {
        MagicLink used = store.create(link("h1", t0));
        store.markUsed(used.getId(), t0);
        store.create(link("h2", t0.minus(Duration.ofHours(1)))); // already expired at t0
        store.create(link("h3", t0.plusSeconds(1)));
        store.create(link("h4", t0.plusSeconds(2)));
        store.create(link("h5", t0.plusSeconds(3)));

        assertThat(repo.count()).isEqualTo(5);
        assertThat(store.listActiveByUser(userId, t0.plusSeconds(4))).hasSize(3);
    }

    @Test
    void create_forUnknownUser_isNotFound() {
        MagicLink l = link("h1", t0);
        l.setUserId(userId + 999);

        assertThatThrownBy(() -> store.create(l))
                .isInstanceOf(AuthException.class)
                .satisfies(e -> assertThat(((AuthException) e).code()).isEqualTo(AuthErrorCode.USER_NOT_FOUND));
    }

    @Test
    void markUsed_isConditional() {
        MagicLink l = store.create(link("h1", t0));

        assertThat(store.markUsed(l.getId(), t0)).isTrue();
        assertThat(store.markUsed(l.getId(), t0.plusSeconds(1))).isFalse();

        MagicLink reloaded = store.getByTokenHash("h1").orElseThrow();
        assertThat(reloaded.isUsed()).isTrue();
        assertThat(reloaded.getUsedAt()).isEqualTo(t0);
    }

    @Test
    void invalidateByUser_andByHashes_flipOnlyUnused() {
        store.create(link("h1", t0));
        store.create(link("h2", t0.plusSeconds(1)));
        store.create(link("h3", t0.plusSeconds(2)));

        assertThat(store.invalidateByTokenHashes(List.of("h1", "nope"), t0)).isEqualTo(1);
        assertThat(store.invalidateByUser(userId, t0)).isEqualTo(2);
        assertThat(store.invalidateByUser(userId, t0)).isZero();
        assertThat(store.invalidateByTokenHashes(List.of(), t0)).isZero();
    }

    @Test
    void cleanup_deletesUnusedRowsExpiredBeforeCutoff() {
        store.create(link("old-unused", t0.minus(Duration.ofDays(3))));
        MagicLink oldUsed = store.create(link("old-used", t0.minus(Duration.ofDays(3)).plusSeconds(1)));
        store.markUsed(oldUsed.getId(), t0.minus(Duration.ofDays(3)));
        store.create(link("fresh", t0));

        int n = store.cleanupExpired(t0.minus(Duration.ofDays(1)));

        assertThat(n).isEqualTo(1);
        assertThat(repo.findAll()).extracting(MagicLink::getTokenHash)
                .containsExactlyInAnyOrder("old-used", "fresh");
    }

    private MagicLink link(String hash, Instant createdAt) {
        MagicLink m = new MagicLink();
        m.setUserId(userId);
        m.setAppId(1);
        m.setTokenHash(hash);
        m.setSessionId("sess_" + createdAt.toEpochMilli() + "_" + userId);
        m.setIpAddress("10.0.0.1");
        m.setUserAgent("JUnit");
        m.setCreatedAt(createdAt);
        m.setExpiresAt(createdAt.plus(Duration.ofMinutes(10)));
        return m;
    }
}
