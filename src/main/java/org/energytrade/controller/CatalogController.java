package org.energytrade.controller;

import org.energytrade.engine.FilterCriteria;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.service.ICatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * 目录查询
 */
@RestController
public class CatalogController {

    private final ICatalogService catalogService;
    private final IBlockLedgerService blockLedgerService;

    public CatalogController(ICatalogService catalogService, IBlockLedgerService blockLedgerService) {
        this.catalogService = catalogService;
        this.blockLedgerService = blockLedgerService;
    }

    @GetMapping("/catalog")
    public ResponseEntity<Map<String, Object>> catalog(
            @RequestParam(name = "source_type", required = false) String sourceType,
            @RequestParam(name = "min_quantity", required = false) Double minQuantity) {
        FilterCriteria criteria = FilterCriteria.builder()
                .sourceType(sourceType == null ? null : sourceType.toUpperCase(Locale.ROOT))
                .minAvailableQuantity(minQuantity)
                .build();
        return ApiResponse.ok("OK", catalogService.getCatalog(criteria));
    }

    @GetMapping("/offers/{offerId}/blocks/stats")
    public ResponseEntity<Map<String, Object>> blockStats(@PathVariable String offerId) {
        return ApiResponse.ok("OK", blockLedgerService.getBlockStats(offerId));
    }
}
