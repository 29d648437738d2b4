package com.transmuter.api.controller;

import com.transmuter.admin.DepositService;
import com.transmuter.admin.NormalizerService;
import com.transmuter.api.dto.Amounts;
import com.transmuter.api.dto.BalanceResponse;
import com.transmuter.api.dto.IssuedResponse;
import com.transmuter.api.dto.NormalizerRequest;
import com.transmuter.api.dto.NormalizerResponse;
import com.transmuter.api.dto.TrustResponse;
import com.transmuter.query.TransmuterQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Ledger-wide supply, holder balances, trust lookups and normalizer updates.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final TransmuterQueryService queryService;
    private final NormalizerService normalizerService;
    private final DepositService depositService;

    @GetMapping("/issued")
    public ResponseEntity<IssuedResponse> getTotalIssued() {
        return ResponseEntity.ok(new IssuedResponse(null, Amounts.format(queryService.getTotalIssued())));
    }

    @GetMapping("/trusted/{address}")
    public ResponseEntity<TrustResponse> getTrust(@PathVariable String address) {
        return ResponseEntity.ok(new TrustResponse(address,
                queryService.isTrusted(address), queryService.isTrustedSeller(address)));
    }

    @GetMapping("/balances/{token}/{holder}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String token, @PathVariable String holder) {
        return ResponseEntity.ok(new BalanceResponse(token, holder,
                Amounts.format(depositService.balanceOf(token, holder))));
    }

    @PostMapping("/normalizer")
    public ResponseEntity<NormalizerResponse> updateNormalizer(@Valid @RequestBody NormalizerRequest request) {
        BigInteger normalizer = normalizerService.updateNormalizer(
                request.caller(), Amounts.parse(request.amount()), request.increase());
        return ResponseEntity.ok(new NormalizerResponse(Amounts.format(normalizer)));
    }
}
