package com.transmuter.api.controller;

import com.transmuter.admin.CollateralAdminService;
import com.transmuter.admin.DepositService;
import com.transmuter.api.dto.AddCollateralRequest;
import com.transmuter.api.dto.AdjustStablecoinsRequest;
import com.transmuter.api.dto.AmountRequest;
import com.transmuter.api.dto.Amounts;
import com.transmuter.api.dto.BalanceResponse;
import com.transmuter.api.dto.DepositRequest;
import com.transmuter.api.dto.FeeCurveDto;
import com.transmuter.api.dto.ManagerRequest;
import com.transmuter.api.dto.OracleConfigDto;
import com.transmuter.api.dto.PauseResponse;
import com.transmuter.api.dto.TrustToggleResponse;
import com.transmuter.api.dto.TrustedRequest;
import com.transmuter.domain.ActionType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Collateral governance. Access control sits in front of this service and is not enforced here.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final CollateralAdminService adminService;
    private final DepositService depositService;

    @PostMapping("/collaterals")
    public ResponseEntity<Void> addCollateral(@Valid @RequestBody AddCollateralRequest request) {
        adminService.addCollateral(request.asset().trim(), request.decimals(), request.oracle().toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @DeleteMapping("/collaterals/{asset}")
    public ResponseEntity<Void> revokeCollateral(@PathVariable String asset) {
        adminService.revokeCollateral(asset);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/collaterals/{asset}/fees/{action}")
    public ResponseEntity<Void> setFees(@PathVariable String asset, @PathVariable ActionType action,
                                       @Valid @RequestBody FeeCurveDto curve) {
        adminService.setFees(asset, action, curve.toDomain());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/collaterals/{asset}/pause/{action}")
    public ResponseEntity<PauseResponse> togglePause(@PathVariable String asset, @PathVariable ActionType action) {
        boolean paused = adminService.togglePause(asset, action);
        return ResponseEntity.ok(new PauseResponse(asset, action, paused));
    }

    @PostMapping("/collaterals/{asset}/adjust")
    public ResponseEntity<Void> adjustStablecoins(@PathVariable String asset,
                                                  @Valid @RequestBody AdjustStablecoinsRequest request) {
        adminService.adjustStablecoins(asset, Amounts.parse(request.amount()), request.increase());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/collaterals/{asset}/cap")
    public ResponseEntity<Void> setStablecoinCap(@PathVariable String asset, @Valid @RequestBody AmountRequest request) {
        adminService.setStablecoinCap(asset, Amounts.parse(request.value()));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/collaterals/{asset}/manager")
    public ResponseEntity<Void> setCollateralManager(@PathVariable String asset, @RequestBody ManagerRequest request) {
        adminService.setCollateralManager(asset, request.toDomain());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/collaterals/{asset}/oracle")
    public ResponseEntity<Void> setOracle(@PathVariable String asset, @Valid @RequestBody OracleConfigDto oracle) {
        adminService.setOracle(asset, oracle.toDomain());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/collaterals/{asset}/oracle/price")
    public ResponseEntity<Void> pushOraclePrice(@PathVariable String asset, @Valid @RequestBody AmountRequest request) {
        adminService.pushOraclePrice(asset, Amounts.parse(request.value()));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/trusted")
    public ResponseEntity<TrustToggleResponse> toggleTrusted(@Valid @RequestBody TrustedRequest request) {
        boolean trusted = adminService.toggleTrusted(request.address(), request.type());
        return ResponseEntity.ok(new TrustToggleResponse(request.address(), request.type(), trusted));
    }

    @PostMapping("/deposits")
    public ResponseEntity<BalanceResponse> deposit(@Valid @RequestBody DepositRequest request) {
        String token = request.token().trim();
        String holder = request.holder().trim();
        BigInteger balance = depositService.deposit(token, holder, Amounts.parse(request.amount()));
        return ResponseEntity.ok(new BalanceResponse(token, holder, Amounts.format(balance)));
    }
}
