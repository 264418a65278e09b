package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.service.AccountService;
import com.example.shotforge_backend.service.billing.CreditBillingGuard;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AccountController.class)
@AutoConfigureMockMvc(addFilters = false)
class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccountService accountService;
    @MockitoBean
    private CreditBillingGuard billingGuard;

    @Test
    void balanceOfKnownAccount() throws Exception {
        Account account = new Account("user-1", "User");
        account.setId(UUID.randomUUID());
        when(accountService.getByExternalSubjectOrThrow("user-1")).thenReturn(account);
        when(billingGuard.balance(account.getId())).thenReturn(40L);

        mockMvc.perform(get("/v1/accounts/user-1/credits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(40));
    }

    @Test
    void unknownAccountIsNotFound() throws Exception {
        when(accountService.getByExternalSubjectOrThrow("ghost"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "OWNER_NOT_FOUND"));

        mockMvc.perform(get("/v1/accounts/ghost/credits"))
                .andExpect(status().isNotFound());
    }

    @Test
    void topUpReturnsNewBalance() throws Exception {
        when(accountService.topUp("user-1", 50L)).thenReturn(75L);

        mockMvc.perform(post("/v1/accounts/user-1/credits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(75));
    }

    @Test
    void nonPositiveTopUpIsRejected() throws Exception {
        mockMvc.perform(post("/v1/accounts/user-1/credits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":0}"))
                .andExpect(status().isBadRequest());
        verify(accountService, never()).topUp(anyString(), anyLong());
    }
}
