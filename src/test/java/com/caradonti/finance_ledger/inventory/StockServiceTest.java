package com.caradonti.finance_ledger.inventory;

import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.money.MoneyPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StockServiceTest {

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private StockService stockService;

    private ProductEntity givenProduct(int stock) {
        ProductEntity product = ProductEntity.fromDomain(Product.create("VELA-01", "Vela aromatica", stock, 5));
        when(productRepository.findById("VELA-01")).thenReturn(Optional.of(product));
        return product;
    }

    @Test
    @DisplayName("A sale takes units off the shelf and adds to revenue")
    void testRecordSale_Decrements() {
        ProductEntity product = givenProduct(20);

        StockLevel level = stockService.recordSale("VELA-01", 3, MoneyPair.of("4500", "0"));

        assertEquals(17, level.getRemaining());
        assertFalse(level.isLow());
        assertEquals(3L, product.getTotalSold());
        assertEquals(new BigDecimal("4500.00"), product.getTotalRevenueArs());
        verify(productRepository).save(product);
    }

    @Test
    @DisplayName("Overselling clamps stock at zero")
    void testRecordSale_ClampsAtZero() {
        givenProduct(2);

        StockLevel level = stockService.recordSale("VELA-01", 5, MoneyPair.of("7500", "0"));

        assertEquals(0, level.getRemaining());
        assertTrue(level.isLow());
        assertEquals(5, level.getQuantitySold());
    }

    @Test
    void testRecordSale_UnknownSku() {
        when(productRepository.findById("NOPE")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> stockService.recordSale("NOPE", 1, MoneyPair.ZERO));
    }

    @Test
    void testCreate_DuplicateSku() {
        when(productRepository.existsById("VELA-01")).thenReturn(true);

        assertThrows(IllegalStateException.class, () -> stockService.create("VELA-01", "Vela", 10, null));
        verify(productRepository, never()).save(any());
    }

    @Test
    void testAdjustStock_RejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> stockService.adjustStock("VELA-01", -1));
    }
}
