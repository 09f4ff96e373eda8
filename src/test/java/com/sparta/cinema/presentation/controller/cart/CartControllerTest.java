package com.sparta.cinema.presentation.controller.cart;

import com.sparta.cinema.application.cart.dto.AddToCartRequest;
import com.sparta.cinema.application.cart.dto.CartItemResponse;
import com.sparta.cinema.application.cart.usecase.AddToCartUseCase;
import com.sparta.cinema.application.cart.usecase.ClearCartUseCase;
import com.sparta.cinema.application.cart.usecase.GetCartUseCase;
import com.sparta.cinema.application.cart.usecase.RemoveFromCartUseCase;
import com.sparta.cinema.application.cart.usecase.UpdateCartItemUseCase;
import com.sparta.cinema.domain.cart.exception.CartItemNotFoundException;
import com.sparta.cinema.domain.movie.exception.ItemUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CartController.class)
@DisplayName("장바구니 컨트롤러 테스트")
class CartControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AddToCartUseCase addToCartUseCase;

    @MockBean
    private GetCartUseCase getCartUseCase;

    @MockBean
    private UpdateCartItemUseCase updateCartItemUseCase;

    @MockBean
    private RemoveFromCartUseCase removeFromCartUseCase;

    @MockBean
    private ClearCartUseCase clearCartUseCase;

    @Test
    @DisplayName("POST /api/cart/items - 영화를 담으면 항목과 소계를 돌려준다")
    void 장바구니_담기() throws Exception {
        given(addToCartUseCase.execute(any(AddToCartRequest.class))).willReturn(new CartItemResponse(
                "M001", "Inception", new BigDecimal("9.99"), 2, new BigDecimal("19.98"), true,
                LocalDateTime.of(2025, 1, 1, 12, 0)));

        mockMvc.perform(post("/api/cart/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"U001\",\"movieId\":\"M001\",\"quantity\":2}"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.movieId").value("M001"))
                .andExpect(jsonPath("$.subtotal").value(19.98));
    }

    @Test
    @DisplayName("POST /api/cart/items - 수량이 0이면 400")
    void 장바구니_담기_수량_검증() throws Exception {
        mockMvc.perform(post("/api/cart/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"U001\",\"movieId\":\"M001\",\"quantity\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"));

        verify(addToCartUseCase, never()).execute(any());
    }

    @Test
    @DisplayName("POST /api/cart/items - 최대 수량을 넘으면 400")
    void 장바구니_담기_최대_수량() throws Exception {
        mockMvc.perform(post("/api/cart/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"U001\",\"movieId\":\"M001\",\"quantity\":2147483647}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"));

        verify(addToCartUseCase, never()).execute(any());
    }

    @Test
    @DisplayName("POST /api/cart/items - 판매 중지된 영화는 409")
    void 판매중지_영화() throws Exception {
        given(addToCartUseCase.execute(any(AddToCartRequest.class)))
                .willThrow(new ItemUnavailableException("M001"));

        mockMvc.perform(post("/api/cart/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"U001\",\"movieId\":\"M001\",\"quantity\":1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("M002"));
    }

    @Test
    @DisplayName("DELETE /api/cart/items/{movieId} - 없는 항목이면 404")
    void 없는_항목_삭제() throws Exception {
        willThrow(new CartItemNotFoundException("M404"))
                .given(removeFromCartUseCase).execute("U001", "M404");

        mockMvc.perform(delete("/api/cart/items/M404").param("userId", "U001"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CART002"));
    }

    @Test
    @DisplayName("DELETE /api/cart - userId가 없으면 400")
    void 비우기_파라미터_누락() throws Exception {
        mockMvc.perform(delete("/api/cart"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"));
    }
}
