package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.CreditsResponse;
import com.example.shotforge_backend.dto.web.TopUpRequest;
import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.service.AccountService;
import com.example.shotforge_backend.service.billing.CreditBillingGuard;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

/**
 * Credit balance of an account.
 */
@RestController
@RequestMapping("/v1/accounts/{ownerExternalSubject}/credits")
public class AccountController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccountController.class);
    private final AccountService accountService;
    private final CreditBillingGuard billingGuard;

    public AccountController(AccountService accountService, CreditBillingGuard billingGuard) {
        this.accountService = accountService;
        this.billingGuard = billingGuard;
    }

    @GetMapping
    public CreditsResponse balance(@PathVariable String ownerExternalSubject) {
        Account account = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        return new CreditsResponse(ownerExternalSubject, billingGuard.balance(account.getId()));
    }

    @PostMapping
    public CreditsResponse topUp(@PathVariable String ownerExternalSubject, @Valid @RequestBody TopUpRequest request) {
        long balance = accountService.topUp(ownerExternalSubject, request.amount());
        LOGGER.info("AccountController topUp owner={} amount={}", ownerExternalSubject, request.amount());
        return new CreditsResponse(ownerExternalSubject, balance);
    }
}
