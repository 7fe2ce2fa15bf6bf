package com.tradezzz.api.controller;

import com.tradezzz.api.dto.request.PositionSizeRequest;
import com.tradezzz.api.dto.request.PriceRequest;
import com.tradezzz.api.dto.request.RiskTradeRequest;
import com.tradezzz.api.dto.request.StopLossRequest;
import com.tradezzz.api.dto.request.TakeProfitRequest;
import com.tradezzz.api.dto.request.UpdateRiskLimitsRequest;
import com.tradezzz.domain.enums.RiskPreset;
import com.tradezzz.exception.ResourceNotFoundException;
import com.tradezzz.ratelimit.ApiRateLimitInterceptor;
import com.tradezzz.risk.ClosedTrade;
import com.tradezzz.risk.RiskLimits;
import com.tradezzz.risk.RiskMetrics;
import com.tradezzz.risk.RiskPosition;
import com.tradezzz.risk.RiskScore;
import com.tradezzz.risk.RiskService;
import com.tradezzz.risk.RiskWarning;
import com.tradezzz.risk.TradeRiskCheck;
import com.tradezzz.risk.sizing.PositionSizeResult;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the caller's risk book.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET/PUT /api/risk/limits, PUT /api/risk/limits/preset/{preset} -- limits</li>
 *   <li>POST /api/risk/check -- pre-trade verdict, never an error for a rejection</li>
 *   <li>POST /api/risk/position-size, /stop-loss, /take-profit -- calculators</li>
 *   <li>GET /api/risk/metrics, /equity-curve, /score, /warnings, /trades -- portfolio state</li>
 *   <li>GET/POST /api/risk/positions, PUT /positions/{id}/price, POST /positions/{id}/close</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskService riskService;

    public RiskController(RiskService riskService) {
        this.riskService = riskService;
    }

    // ==================== Limits ====================

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getLimits(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(riskService.getLimits(userId));
    }

    /** Applies only the non-null fields of the body. */
    @PutMapping("/limits")
    public ResponseEntity<RiskLimits> updateLimits(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody UpdateRiskLimitsRequest request) {
        RiskLimits updated = request.applyTo(riskService.getLimits(userId));
        log.info("Risk limits update for user {}: {}", userId, updated);
        return ResponseEntity.ok(riskService.updateLimits(userId, updated));
    }

    @PutMapping("/limits/preset/{preset}")
    public ResponseEntity<RiskLimits> applyPreset(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId, @PathVariable String preset) {
        return ResponseEntity.ok(riskService.applyPreset(userId, RiskPreset.valueOf(preset.toUpperCase())));
    }

    // ==================== Calculators ====================

    @PostMapping("/check")
    public ResponseEntity<TradeRiskCheck> checkTrade(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody RiskTradeRequest request) {
        return ResponseEntity.ok(riskService.checkTradeRisk(
                userId,
                request.getSymbol(),
                request.getDirection(),
                request.getSize(),
                request.getEntryPrice(),
                request.getStopLoss(),
                request.getTakeProfit()));
    }

    @PostMapping("/position-size")
    public ResponseEntity<PositionSizeResult> calculatePositionSize(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody PositionSizeRequest request) {
        return ResponseEntity.ok(riskService.calculatePosition(
                userId,
                request.getMethod(),
                request.getRiskPercentage(),
                request.getFixedAmount(),
                request.getVolatility(),
                request.getAvgVolatility()));
    }

    @PostMapping("/stop-loss")
    public ResponseEntity<Map<String, Double>> calculateStopLoss(@Valid @RequestBody StopLossRequest request) {
        double stopLoss = riskService.calculateStopLoss(
                request.getEntryPrice(), request.getDirection(), request.getRiskPercent(), request.getAtr());
        return ResponseEntity.ok(Map.of("stopLoss", stopLoss));
    }

    @PostMapping("/take-profit")
    public ResponseEntity<Map<String, Double>> calculateTakeProfit(@Valid @RequestBody TakeProfitRequest request) {
        double takeProfit = riskService.calculateTakeProfit(
                request.getEntryPrice(), request.getStopLoss(), request.getDirection(), request.getRiskRewardRatio());
        return ResponseEntity.ok(Map.of("takeProfit", takeProfit));
    }

    // ==================== Portfolio state ====================

    @GetMapping("/metrics")
    public ResponseEntity<RiskMetrics> getMetrics(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(riskService.getMetrics(userId));
    }

    @GetMapping("/equity-curve")
    public ResponseEntity<List<Double>> getEquityCurve(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(riskService.getEquityCurve(userId));
    }

    @GetMapping("/score")
    public ResponseEntity<RiskScore> getScore(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(riskService.getRiskScore(userId));
    }

    @GetMapping("/warnings")
    public ResponseEntity<List<RiskWarning>> getWarnings(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(riskService.getWarnings(userId, limit));
    }

    @GetMapping("/trades")
    public ResponseEntity<List<ClosedTrade>> getTrades(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(riskService.getTrades(userId));
    }

    // ==================== Positions ====================

    @GetMapping("/positions")
    public ResponseEntity<List<RiskPosition>> getPositions(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(riskService.getPositions(userId));
    }

    @PostMapping("/positions")
    public ResponseEntity<RiskPosition> openPosition(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody RiskTradeRequest request) {
        RiskPosition position = riskService.openPosition(
                userId,
                request.getSymbol(),
                request.getDirection(),
                request.getSize(),
                request.getEntryPrice(),
                request.getStopLoss(),
                request.getTakeProfit());
        return ResponseEntity.status(HttpStatus.CREATED).body(position);
    }

    @PutMapping("/positions/{positionId}/price")
    public ResponseEntity<RiskPosition> updatePositionPrice(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @PathVariable String positionId,
            @Valid @RequestBody PriceRequest request) {
        return ResponseEntity.ok(riskService.updatePosition(userId, positionId, request.getPrice())
                .orElseThrow(() -> new ResourceNotFoundException("Position", positionId)));
    }

    @PostMapping("/positions/{positionId}/close")
    public ResponseEntity<ClosedTrade> closePosition(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @PathVariable String positionId,
            @Valid @RequestBody PriceRequest request) {
        return ResponseEntity.ok(riskService.closePosition(userId, positionId, request.getPrice())
                .orElseThrow(() -> new ResourceNotFoundException("Position", positionId)));
    }
}
