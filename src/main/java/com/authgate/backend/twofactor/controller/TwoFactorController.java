package com.authgate.backend.twofactor.controller;

import com.authgate.backend.auth.security.AuthContext;
import com.authgate.backend.common.web.ClientIp;
import com.authgate.backend.twofactor.dto.InvalidateResponse;
import com.authgate.backend.twofactor.dto.MagicLinkConfirmedResponse;
import com.authgate.backend.twofactor.dto.MagicLinkSentResponse;
import com.authgate.backend.twofactor.service.MagicLinkConfirmation;
import com.authgate.backend.twofactor.service.MagicLinkIssued;
import com.authgate.backend.twofactor.service.SendMagicLinkCommand;
import com.authgate.backend.twofactor.service.TwoFactorService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth/2fa")
@RequiredArgsConstructor
public class TwoFactorController {

    private final TwoFactorService twoFactorService;
    private final AuthContext auth;

    /** Mails a sign-in confirmation link to the bearer's address. */
    @PostMapping("/magic-link")
    public ResponseEntity<MagicLinkSentResponse> send(HttpServletRequest http) {
        MagicLinkIssued issued = twoFactorService.sendMagicLink(new SendMagicLinkCommand(
                auth.requireUserId(),
                auth.requireAppId(),
                auth.requireEmail(),
                ClientIp.resolve(http),
                ClientIp.userAgent(http)
        ));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new MagicLinkSentResponse("sent", issued.sessionId(), issued.expiresAt()));
    }

    @GetMapping("/verify-link")
    public ResponseEntity<MagicLinkConfirmedResponse> verifyLink(@RequestParam("token") String token) {
        MagicLinkConfirmation c = twoFactorService.consume(token);
        return ResponseEntity.ok(new MagicLinkConfirmedResponse("confirmed", c.userId(), c.appId(), c.sessionId()));
    }

    @PostMapping("/invalidate")
    public ResponseEntity<InvalidateResponse> invalidate() {
        int n = twoFactorService.invalidateMagicLinksByUserId(auth.requireUserId());
        return ResponseEntity.ok(new InvalidateResponse(n));
    }
}
