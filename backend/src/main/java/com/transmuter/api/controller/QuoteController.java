package com.transmuter.api.controller;

import com.transmuter.api.dto.Amounts;
import com.transmuter.api.dto.QuoteResponse;
import com.transmuter.swap.SwapService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Read-only swap quotes: GET /quotes/in (fixed input) and GET /quotes/out (fixed output).
 */
@RestController
@RequestMapping("/api/v1/quotes")
@RequiredArgsConstructor
public class QuoteController {

    private final SwapService swapService;

    @GetMapping("/in")
    public ResponseEntity<QuoteResponse> quoteIn(
            @RequestParam String amountIn,
            @RequestParam String tokenIn,
            @RequestParam String tokenOut
    ) {
        BigInteger amountOut = swapService.quoteIn(Amounts.parse(amountIn), tokenIn, tokenOut);
        return ResponseEntity.ok(new QuoteResponse(tokenIn, tokenOut, amountIn, Amounts.format(amountOut)));
    }

    @GetMapping("/out")
    public ResponseEntity<QuoteResponse> quoteOut(
            @RequestParam String amountOut,
            @RequestParam String tokenIn,
            @RequestParam String tokenOut
    ) {
        BigInteger amountIn = swapService.quoteOut(Amounts.parse(amountOut), tokenIn, tokenOut);
        return ResponseEntity.ok(new QuoteResponse(tokenIn, tokenOut, Amounts.format(amountIn), amountOut));
    }
}
