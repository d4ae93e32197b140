package com.tasklane.backend.modules.auth.application;

import java.time.Clock;

import com.tasklane.backend.global.error.ProblemException;
import com.tasklane.backend.global.security.CallerIdentity;
import com.tasklane.backend.modules.auth.domain.Account;
import com.tasklane.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.tasklane.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.tasklane.backend.modules.auth.presentation.dto.AccountResponse;
import com.tasklane.backend.modules.auth.presentation.dto.LoginRequest;
import com.tasklane.backend.modules.auth.presentation.dto.LoginResponse;
import com.tasklane.backend.modules.auth.presentation.dto.RegisterRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    static final String LOGIN_HANDLE_TAKEN = "LOGIN_HANDLE_TAKEN";
    static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";

    private final AccountRepository accountRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenIssuer tokenIssuer;
    private final Clock clock;

    public AuthService(
            AccountRepository accountRepository,
            PasswordHasher passwordHasher,
            JwtTokenIssuer tokenIssuer,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.passwordHasher = passwordHasher;
        this.tokenIssuer = tokenIssuer;
        this.clock = clock;
    }

    /**
     * Creates an account and signs the caller in. Concurrent registrations of the same
     * handle are settled by the unique constraint on {@code login_handle}: exactly one
     * insert commits and the others get 409.
     */
    public LoginResponse register(RegisterRequest request) {
        String loginHandle = Account.normalizeHandle(request.email());
        if (accountRepository.existsByLoginHandleIgnoreCase(loginHandle)) {
            throw loginHandleTaken();
        }

        String digest = passwordHasher.hash(request.password());
        Account account;
        try {
            account = accountRepository.saveAndFlush(new Account(loginHandle, digest));
        } catch (DataIntegrityViolationException ex) {
            log.debug("Registration lost the race for handle {}", loginHandle);
            throw loginHandleTaken();
        }

        log.info("Registered account {}", account.getId());
        return signIn(account);
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        Account account = accountRepository.findByLoginHandleIgnoreCase(Account.normalizeHandle(request.email()))
                .orElse(null);

        if (account == null) {
            passwordHasher.verifyAgainstDecoy(request.password());
            throw invalidCredentials();
        }
        boolean matches;
        try {
            matches = passwordHasher.verify(request.password(), account.getPasswordDigest());
        } catch (CorruptCredentialException ex) {
            log.error("Stored password digest for account {} is unreadable", account.getId());
            throw ex;
        }
        if (!matches) {
            throw invalidCredentials();
        }

        return signIn(account);
    }

    /**
     * Tokens are not tracked server-side, so logging out only discards the token on the
     * client. The call succeeds with or without a valid credential.
     */
    public void logout(CallerIdentity caller) {
        if (caller != null) {
            log.info("Account {} logged out", caller.accountId());
        }
    }

    @Transactional(readOnly = true)
    public AccountResponse loadProfile(CallerIdentity caller) {
        Account account = accountRepository.findById(caller.accountId())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, ACCOUNT_NOT_FOUND,
                        "The authenticated account no longer exists"));
        return AccountResponse.from(account);
    }

    private LoginResponse signIn(Account account) {
        IssuedToken token = tokenIssuer.issue(account.getId(), clock.instant());
        return new LoginResponse(AccessTokenResponse.from(token), AccountResponse.from(account));
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid email or password");
    }

    private static ProblemException loginHandleTaken() {
        return new ProblemException(HttpStatus.CONFLICT, LOGIN_HANDLE_TAKEN, "An account with this email already exists");
    }
}
