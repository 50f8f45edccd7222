package com.authgate.backend.twofactor.job;

import com.authgate.backend.auth.store.CredentialStoreException;
import com.authgate.backend.twofactor.service.TwoFactorService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;

class MagicLinkCleanupJobTest {

    @Test
    void runDaily_delegatesToCleanup() {
        TwoFactorService service = Mockito.mock(TwoFactorService.class);
        Mockito.when(service.cleanupExpired()).thenReturn(3);

        new MagicLinkCleanupJob(service).runDaily();

        Mockito.verify(service).cleanupExpired();
    }

    @Test
    void runDaily_storeFailure_doesNotEscape() {
        TwoFactorService service = Mockito.mock(TwoFactorService.class);
        Mockito.when(service.cleanupExpired()).thenThrow(
                CredentialStoreException.wrap("magicLink.cleanupExpired", new DataAccessResourceFailureException("db down")));

        assertThatCode(() -> new MagicLinkCleanupJob(service).runDaily()).doesNotThrowAnyException();
    }
}
