package com.mailmirror.controller;

import com.mailmirror.domain.Account;
import com.mailmirror.exception.MirrorException;
import com.mailmirror.service.MirrorSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Account status REST API
 * - List accounts (GET /api/accounts)
 * - Get account (GET /api/accounts/{name})
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final MirrorSupervisor supervisor;

    /**
     * List accounts
     * GET /api/accounts
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listAccounts() {
        List<Map<String, Object>> accounts = supervisor.getAccounts().stream()
                .map(this::describe)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", accounts.size());
        response.put("failed", supervisor.failedCount());
        response.put("accounts", accounts);

        return ResponseEntity.ok(response);
    }

    /**
     * Get account
     * GET /api/accounts/{name}
     */
    @GetMapping("/{name}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable String name) {
        Optional<Account> account = supervisor.findAccount(name);
        if (account.isEmpty()) {
            return errorResponse(HttpStatus.NOT_FOUND, "Account not found: " + name);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.putAll(describe(account.get()));

        return ResponseEntity.ok(response);
    }

    private Map<String, Object> describe(Account account) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", account.getName());
        map.put("source", account.getSource().credentials().toString());
        map.put("target", account.getTarget().credentials().toString());
        map.put("state", account.getState().name());
        map.put("processed", account.getProcessedCount());

        MirrorException error = account.getLastError();
        if (error != null) {
            map.put("lastError", error.getMessage());
            map.put("failedIn", error.getState() != null ? error.getState().name() : null);
        }
        return map;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
