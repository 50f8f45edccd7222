package com.authgate.backend.twofactor.store;

import com.authgate.backend.auth.repo.UserRepo;
import com.authgate.backend.auth.store.CredentialStoreException;
import com.authgate.backend.auth.web.AuthErrorCode;
import com.authgate.backend.auth.web.AuthException;
import com.authgate.backend.twofactor.config.TwoFactorProperties;
import com.authgate.backend.twofactor.entity.MagicLink;
import com.authgate.backend.twofactor.repo.MagicLinkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMagicLinkStore implements MagicLinkStore {

    private final MagicLinkRepository repo;
    private final UserRepo users;
    private final TwoFactorProperties props;

    /**
     * The user row lock serializes concurrent issuance for one user, so two requests cannot both
     * see two active links and both insert a third.
     */
    @Override
    @Transactional
    public MagicLink create(MagicLink link) {
        try {
            if (users.findByIdForUpdate(link.getUserId()).isEmpty()) {
                throw new AuthException(AuthErrorCode.USER_NOT_FOUND, "User not found");
            }
            List<MagicLink> active = repo.findActiveByUser(link.getUserId(), link.getCreatedAt());
            int excess = active.size() - (Math.max(1, props.getMaxActiveLinks()) - 1);
            if (excess > 0) {
                List<Long> evict = active.subList(0, excess).stream().map(MagicLink::getId).toList();
                repo.deleteByIds(evict);
                log.info("evicted oldest magic links userId={} count={}", link.getUserId(), evict.size());
            }
            return repo.saveAndFlush(link);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.create", e);
        }
    }

    @Override
    public Optional<MagicLink> getByTokenHash(String tokenHash) {
        try {
            return repo.findByTokenHash(tokenHash);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.getByTokenHash", e);
        }
    }

    @Override
    @Transactional
    public boolean markUsed(long id, Instant usedAt) {
        try {
            return repo.markUsed(id, usedAt) == 1;
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.markUsed", e);
        }
    }

    @Override
    public List<MagicLink> listActiveByUser(long userId, Instant now) {
        try {
            return repo.findActiveByUser(userId, now);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.listActiveByUser", e);
        }
    }

    @Override
    @Transactional
    public int invalidateByUser(long userId, Instant now) {
        try {
            return repo.invalidateByUser(userId, now);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.invalidateByUser", e);
        }
    }

    @Override
    @Transactional
    public int invalidateByTokenHashes(Collection<String> tokenHashes, Instant now) {
        if (tokenHashes == null || tokenHashes.isEmpty()) return 0;
        try {
            return repo.invalidateByTokenHashes(tokenHashes, now);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.invalidateByTokenHashes", e);
        }
    }

    @Override
    @Transactional
    public int cleanupExpired(Instant cutoff) {
        try {
            return repo.deleteExpiredUnused(cutoff);
        } catch (DataAccessException e) {
            throw CredentialStoreException.wrap("magicLink.cleanupExpired", e);
        }
    }
}
