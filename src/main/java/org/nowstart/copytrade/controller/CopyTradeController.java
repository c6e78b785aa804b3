package org.nowstart.copytrade.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.nowstart.copytrade.data.dto.MirrorDispatchResult;
import org.nowstart.copytrade.data.dto.MirrorTradeDto;
import org.nowstart.copytrade.data.dto.MirrorTradeStatsDto;
import org.nowstart.copytrade.data.dto.PnlReconcileOutcome;
import org.nowstart.copytrade.data.dto.PnlSyncResult;
import org.nowstart.copytrade.data.dto.PositionSizeRequest;
import org.nowstart.copytrade.data.dto.PositionSizeResult;
import org.nowstart.copytrade.data.dto.WalletRefreshResult;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.service.FollowerWalletService;
import org.nowstart.copytrade.service.MirrorTradeOrchestrator;
import org.nowstart.copytrade.service.MirrorTradeQueryService;
import org.nowstart.copytrade.service.PnlReconciliationService;
import org.nowstart.copytrade.service.PositionSizingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/copy-trading")
@Tag(name = "CopyTrading", description = "미러 주문 실행, 포지션 사이징, 손익 정산, 팔로워 지갑 갱신 API")
public class CopyTradeController {

    private final MirrorTradeOrchestrator mirrorTradeOrchestrator;
    private final PositionSizingService positionSizingService;
    private final MirrorTradeQueryService mirrorTradeQueryService;
    private final PnlReconciliationService pnlReconciliationService;
    private final FollowerWalletService followerWalletService;

    public CopyTradeController(
            MirrorTradeOrchestrator mirrorTradeOrchestrator,
            PositionSizingService positionSizingService,
            MirrorTradeQueryService mirrorTradeQueryService,
            PnlReconciliationService pnlReconciliationService,
            FollowerWalletService followerWalletService
    ) {
        this.mirrorTradeOrchestrator = mirrorTradeOrchestrator;
        this.positionSizingService = positionSizingService;
        this.mirrorTradeQueryService = mirrorTradeQueryService;
        this.pnlReconciliationService = pnlReconciliationService;
        this.followerWalletService = followerWalletService;
    }

    @PostMapping("/primary-trades/{primaryTradeId}/mirror")
    @Operation(summary = "미러 주문 실행", description = "활성 팔로워 전원에게 대기 미러 주문을 만들고 비동기로 실행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "실행 접수"),
            @ApiResponse(responseCode = "404", description = "원본 거래 없음")
    })
    public ResponseEntity<MirrorDispatchResult> mirror(@PathVariable String primaryTradeId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(mirrorTradeOrchestrator.mirrorById(primaryTradeId));
    }

    @PostMapping("/position-size")
    @Operation(summary = "포지션 사이징 미리보기", description = "리스크 비율과 손절가로 거래소 규격에 맞는 수량/레버리지/증거금을 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "계산 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "사이징 불가")
    })
    public PositionSizeResult previewPositionSize(@RequestBody @Valid PositionSizeRequest request) {
        return positionSizingService.preview(request);
    }

    @GetMapping("/mirror-trades")
    @Operation(summary = "미러 주문 목록", description = "팔로워/상태로 필터링한 미러 주문을 최신순으로 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<MirrorTradeDto> getMirrorTrades(
            @RequestParam(value = "followerId", required = false) String followerId,
            @RequestParam(value = "status", required = false) MirrorTradeStatus status
    ) {
        return mirrorTradeQueryService.list(followerId, status);
    }

    @GetMapping("/mirror-trades/stats")
    @Operation(summary = "카피 트레이딩 통계", description = "전체/체결/실패/대기 건수와 성공률, 실현 손익 합계를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public MirrorTradeStatsDto getStats(@RequestParam(value = "followerId", required = false) String followerId) {
        return mirrorTradeQueryService.stats(followerId);
    }

    @PostMapping("/mirror-trades/{mirrorTradeId}/pnl")
    @Operation(summary = "단건 손익 정산", description = "거래소 원장을 조회해 미러 주문의 실현 손익과 청산가를 기록합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "정산 결과"),
            @ApiResponse(responseCode = "404", description = "미러 주문 없음")
    })
    public PnlReconcileOutcome reconcilePnl(@PathVariable String mirrorTradeId) {
        return pnlReconciliationService.reconcile(mirrorTradeId);
    }

    @PostMapping("/pnl/sync")
    @Operation(summary = "손익 일괄 정산", description = "손익이 비어 있는 체결 미러 주문 전체를 정산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "정산 완료")
    })
    public PnlSyncResult syncPnl() {
        return pnlReconciliationService.reconcileAll();
    }

    @PostMapping("/followers/wallets/refresh")
    @Operation(summary = "팔로워 지갑 갱신", description = "팔로워 선물 지갑 잔고를 조회하고 잔고 부족 여부를 갱신합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "갱신 완료")
    })
    public WalletRefreshResult refreshWallets() {
        return followerWalletService.refreshAll();
    }
}
