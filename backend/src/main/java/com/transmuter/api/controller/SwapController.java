package com.transmuter.api.controller;

import com.transmuter.api.dto.Amounts;
import com.transmuter.api.dto.SwapRequest;
import com.transmuter.api.dto.SwapResponse;
import com.transmuter.swap.SwapResult;
import com.transmuter.swap.SwapService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /swaps/exact-input, POST /swaps/exact-output.
 */
@RestController
@RequestMapping("/api/v1/swaps")
@RequiredArgsConstructor
public class SwapController {

    private final SwapService swapService;

    @PostMapping("/exact-input")
    public ResponseEntity<SwapResponse> swapExactInput(@Valid @RequestBody SwapRequest request) {
        SwapResult result = swapService.swapExactInput(
                Amounts.parse(request.amount()),
                Amounts.parse(request.limit()),
                request.tokenIn(),
                request.tokenOut(),
                request.to(),
                request.sender(),
                request.deadline());
        return ResponseEntity.ok(toResponse(result));
    }

    @PostMapping("/exact-output")
    public ResponseEntity<SwapResponse> swapExactOutput(@Valid @RequestBody SwapRequest request) {
        SwapResult result = swapService.swapExactOutput(
                Amounts.parse(request.amount()),
                Amounts.parse(request.limit()),
                request.tokenIn(),
                request.tokenOut(),
                request.to(),
                request.sender(),
                request.deadline());
        return ResponseEntity.ok(toResponse(result));
    }

    private static SwapResponse toResponse(SwapResult result) {
        return new SwapResponse(result.tokenIn(), result.tokenOut(),
                Amounts.format(result.amountIn()), Amounts.format(result.amountOut()));
    }
}
