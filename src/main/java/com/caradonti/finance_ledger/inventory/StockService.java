package com.caradonti.finance_ledger.inventory;

import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Product catalogue and stock levels.
 *
 * {@link #recordSale} joins the caller's transaction so the stock decrement
 * commits or rolls back with the shop entry that recorded the sale.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private static final String RESOURCE = "Product";

    private final ProductRepository productRepository;

    @Transactional
    public Product create(String sku, String name, int currentStock, Integer minStockThreshold) {
        Product product = Product.create(sku, name, currentStock, minStockThreshold);
        if (productRepository.existsById(product.getSku())) {
            throw new IllegalStateException("Product already exists: " + product.getSku());
        }
        productRepository.save(ProductEntity.fromDomain(product));
        log.info("Product created: sku={}, stock={}", product.getSku(), product.getCurrentStock());
        return product;
    }

    @Transactional(readOnly = true)
    public Product get(String sku) {
        return productRepository.findById(sku)
            .map(ProductEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(RESOURCE, sku));
    }

    @Transactional(readOnly = true)
    public List<Product> listLowStock() {
        return productRepository.findLowStock().stream()
            .map(ProductEntity::toDomain)
            .toList();
    }

    @Transactional
    public Product adjustStock(String sku, int newStock) {
        if (newStock < 0) {
            throw new IllegalArgumentException("Stock must not be negative");
        }
        ProductEntity product = productRepository.findById(sku)
            .orElseThrow(() -> new NotFoundException(RESOURCE, sku));
        product.adjustStock(newStock);
        return productRepository.save(product).toDomain();
    }

    /**
     * Decrements stock for a sale of {@code quantity} units, clamping at zero.
     *
     * @return stock after the sale
     * @throws NotFoundException if no product has this SKU
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockLevel recordSale(String sku, int quantity, MoneyPair revenue) {
        ProductEntity product = productRepository.findById(sku)
            .orElseThrow(() -> new NotFoundException(RESOURCE, sku));
        int before = product.getCurrentStock();
        product.recordSale(quantity, revenue);
        productRepository.save(product);

        if (before < quantity) {
            log.warn("Sale of {} x {} exceeded stock of {}, stock clamped at zero", quantity, sku, before);
        }
        return new StockLevel(product.getSku(), product.getName(), quantity,
            product.getCurrentStock(), product.getMinStockThreshold());
    }
}
