package com.caradonti.finance_ledger.inventory;

import com.caradonti.finance_ledger.inventory.dto.CreateProductRequest;
import com.caradonti.finance_ledger.inventory.dto.ProductResponse;
import com.caradonti.finance_ledger.inventory.dto.StockAdjustmentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final StockService stockService;

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request) {
        Product product = stockService.create(request.getSku(), request.getName(),
            request.getCurrentStock(), request.getMinStockThreshold());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @GetMapping("/{sku}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("sku") String sku) {
        return ResponseEntity.ok(ProductResponse.from(stockService.get(sku)));
    }

    @PutMapping("/{sku}/stock")
    public ResponseEntity<ProductResponse> adjustStock(@PathVariable("sku") String sku,
                                                       @Valid @RequestBody StockAdjustmentRequest request) {
        return ResponseEntity.ok(ProductResponse.from(stockService.adjustStock(sku, request.getCurrentStock())));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<List<ProductResponse>> listLowStock() {
        return ResponseEntity.ok(stockService.listLowStock().stream()
            .map(ProductResponse::from)
            .toList());
    }
}
