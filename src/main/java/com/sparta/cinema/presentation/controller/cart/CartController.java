package com.sparta.cinema.presentation.controller.cart;

import com.sparta.cinema.application.cart.dto.AddToCartRequest;
import com.sparta.cinema.application.cart.dto.CartItemResponse;
import com.sparta.cinema.application.cart.dto.CartResponse;
import com.sparta.cinema.application.cart.dto.UpdateCartItemRequest;
import com.sparta.cinema.application.cart.usecase.AddToCartUseCase;
import com.sparta.cinema.application.cart.usecase.ClearCartUseCase;
import com.sparta.cinema.application.cart.usecase.GetCartUseCase;
import com.sparta.cinema.application.cart.usecase.RemoveFromCartUseCase;
import com.sparta.cinema.application.cart.usecase.UpdateCartItemUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 장바구니 관리 API
 */
@Tag(name = "장바구니 관리", description = "장바구니 영화 담기/수정/삭제 API")
@RestController
@RequestMapping("/api/cart")
@RequiredArgsConstructor
public class CartController {

    private final AddToCartUseCase addToCartUseCase;
    private final GetCartUseCase getCartUseCase;
    private final UpdateCartItemUseCase updateCartItemUseCase;
    private final RemoveFromCartUseCase removeFromCartUseCase;
    private final ClearCartUseCase clearCartUseCase;

    /**
     * 장바구니 조회
     * GET /api/cart
     */
    @Operation(summary = "장바구니 조회", description = "담은 순서대로 장바구니 항목을 조회합니다")
    @GetMapping
    public ResponseEntity<CartResponse> getCart(
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        return ResponseEntity.ok(getCartUseCase.execute(userId));
    }

    /**
     * 장바구니 담기
     * POST /api/cart/items
     */
    @Operation(summary = "장바구니 담기", description = "장바구니에 영화를 담습니다. 이미 담긴 영화는 수량이 늘어납니다")
    @PostMapping("/items")
    public ResponseEntity<CartItemResponse> addCartItem(@Valid @RequestBody AddToCartRequest request) {
        return ResponseEntity.ok(addToCartUseCase.execute(request));
    }

    /**
     * 수량 변경
     * PATCH /api/cart/items/{movieId}
     */
    @Operation(summary = "장바구니 수량 변경", description = "장바구니 항목의 수량을 변경합니다")
    @PatchMapping("/items/{movieId}")
    public ResponseEntity<CartItemResponse> updateCartItemQuantity(
            @Parameter(description = "사용자 ID") @RequestParam String userId,
            @Parameter(description = "영화 ID") @PathVariable String movieId,
            @Valid @RequestBody UpdateCartItemRequest request) {

        return ResponseEntity.ok(updateCartItemUseCase.execute(userId, movieId, request.quantity()));
    }

    /**
     * 항목 삭제
     * DELETE /api/cart/items/{movieId}
     */
    @Operation(summary = "장바구니 항목 삭제", description = "장바구니에서 영화를 뺍니다")
    @DeleteMapping("/items/{movieId}")
    public ResponseEntity<Map<String, String>> deleteCartItem(
            @Parameter(description = "사용자 ID") @RequestParam String userId,
            @Parameter(description = "영화 ID") @PathVariable String movieId) {

        removeFromCartUseCase.execute(userId, movieId);
        return ResponseEntity.ok(Map.of("message", "장바구니에서 삭제되었습니다"));
    }

    /**
     * 장바구니 비우기
     * DELETE /api/cart
     */
    @Operation(summary = "장바구니 비우기", description = "장바구니의 모든 항목을 삭제합니다")
    @DeleteMapping
    public ResponseEntity<Map<String, String>> clearCart(
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        clearCartUseCase.execute(userId);
        return ResponseEntity.ok(Map.of("message", "장바구니를 비웠습니다"));
    }
}
