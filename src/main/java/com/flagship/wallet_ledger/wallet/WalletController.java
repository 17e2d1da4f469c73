package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.transfer.WalletLedgerService;
import com.flagship.wallet_ledger.transfer.WalletSnapshot;
import com.flagship.wallet_ledger.wallet.dto.FundsRequest;
import com.flagship.wallet_ledger.wallet.dto.TransactionResponse;
import com.flagship.wallet_ledger.wallet.dto.WalletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST surface for a user's own wallet.
 *
 * Authentication happens upstream; the authenticated user's id arrives in the
 * X-User-Id header. Order, owner-credit and delivery-fee movements are not
 * exposed here: they are triggered in-process by the order and delivery flows
 * through {@link WalletLedgerService}.
 */
@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final WalletLedgerService walletLedgerService;

    @GetMapping
    public ResponseEntity<WalletResponse> getWallet(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(walletView(userId));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactions(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(transactions(userId));
    }

    @PostMapping("/deposit")
    public ResponseEntity<WalletResponse> deposit(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                  @Valid @RequestBody FundsRequest request) {
        log.info("Received deposit request: amount={}", request.getAmount());
        walletLedgerService.deposit(userId, request.getAmount(), request.getReference());
        return ResponseEntity.ok(walletView(userId));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<WalletResponse> withdraw(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                   @Valid @RequestBody FundsRequest request) {
        log.info("Received withdrawal request: amount={}", request.getAmount());
        walletLedgerService.withdraw(userId, request.getAmount(), request.getReference());
        return ResponseEntity.ok(walletView(userId));
    }

    private WalletResponse walletView(UUID userId) {
        WalletSnapshot snapshot = walletLedgerService.getWalletSnapshot(userId);
        return WalletResponse.builder()
            .balance(snapshot.getBalance())
            .updatedAt(snapshot.getUpdatedAt())
            .transactions(toResponses(snapshot.getTransactions()))
            .build();
    }

    private List<TransactionResponse> transactions(UUID userId) {
        return toResponses(walletLedgerService.listTransactions(userId));
    }

    private static List<TransactionResponse> toResponses(List<TransactionRecord> records) {
        return records.stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
