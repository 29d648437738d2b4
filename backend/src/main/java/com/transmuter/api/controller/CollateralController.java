package com.transmuter.api.controller;

import com.transmuter.api.dto.Amounts;
import com.transmuter.api.dto.CollateralResponse;
import com.transmuter.api.dto.IssuedResponse;
import com.transmuter.api.dto.OracleValuesResponse;
import com.transmuter.query.IssuedStablecoins;
import com.transmuter.query.OracleValues;
import com.transmuter.query.TransmuterQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/collaterals")
@RequiredArgsConstructor
public class CollateralController {

    private final TransmuterQueryService queryService;

    @GetMapping
    public ResponseEntity<List<String>> getCollateralList() {
        return ResponseEntity.ok(queryService.getCollateralList());
    }

    @GetMapping("/{asset}")
    public ResponseEntity<CollateralResponse> getCollateral(@PathVariable String asset) {
        return ResponseEntity.ok(CollateralResponse.from(queryService.getCollateralInfo(asset)));
    }

    @GetMapping("/{asset}/issued")
    public ResponseEntity<IssuedResponse> getIssued(@PathVariable String asset) {
        IssuedStablecoins issued = queryService.getIssuedByCollateral(asset);
        return ResponseEntity.ok(new IssuedResponse(
                Amounts.format(issued.stablecoinsFromCollateral()),
                Amounts.format(issued.stablecoinsIssued())));
    }

    @GetMapping("/{asset}/oracle")
    public ResponseEntity<OracleValuesResponse> getOracleValues(@PathVariable String asset) {
        OracleValues values = queryService.getOracleValues(asset);
        return ResponseEntity.ok(new OracleValuesResponse(
                Amounts.format(values.mint()),
                Amounts.format(values.burn()),
                Amounts.format(values.deviation())));
    }
}
