package com.wtwr.wardrobe.api;

import com.wtwr.common.Result;
import com.wtwr.wardrobe.api.dto.ClothingItemResponse;
import com.wtwr.wardrobe.api.dto.DataResponse;
import com.wtwr.wardrobe.domain.ClothingItem;
import com.wtwr.wardrobe.domain.ClothingItemService;
import com.wtwr.wardrobe.infrastructure.web.Reply;
import com.wtwr.wardrobe.infrastructure.web.RequestPipeline;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Clothing item routes. Listing is public; creating, deleting, liking and disliking need an
 * authenticated caller.
 */
@RestController
@RequestMapping("/items")
public class ClothingItemController {

    private final RequestPipeline pipeline;
    private final ClothingItemService items;

    public ClothingItemController(RequestPipeline pipeline, ClothingItemService items) {
        this.pipeline = pipeline;
        this.items = items;
    }

    @GetMapping
    public ResponseEntity<?> list(HttpServletRequest request) {
        return pipeline.run(request,
                () -> Result.ok(Reply.ok(items.list().stream().map(ClothingItemResponse::from).toList())));
    }

    @PostMapping
    public ResponseEntity<?> create(
            @RequestBody(required = false) Map<String, Object> body, HttpServletRequest request) {
        return pipeline.runAuthenticated(RouteSchemas.CREATE_ITEM, body, Map.of(), request,
                (caller, input) -> items.create(caller.subject(), input)
                        .map(item -> Reply.created(ClothingItemResponse.from(item))));
    }

    @DeleteMapping("/{itemId}")
    public ResponseEntity<?> delete(@PathVariable String itemId, HttpServletRequest request) {
        return pipeline.runAuthenticated(RouteSchemas.ITEM_ID, Map.of(), Map.of("itemId", itemId), request,
                (caller, input) -> items.delete(input.string("itemId"), caller.subject()).map(ClothingItemController::data));
    }

    @PutMapping("/{itemId}/likes")
    public ResponseEntity<?> like(@PathVariable String itemId, HttpServletRequest request) {
        return pipeline.runAuthenticated(RouteSchemas.ITEM_ID, Map.of(), Map.of("itemId", itemId), request,
                (caller, input) -> items.like(input.string("itemId"), caller.subject()).map(ClothingItemController::data));
    }

    @DeleteMapping("/{itemId}/likes")
    public ResponseEntity<?> dislike(@PathVariable String itemId, HttpServletRequest request) {
        return pipeline.runAuthenticated(RouteSchemas.ITEM_ID, Map.of(), Map.of("itemId", itemId), request,
                (caller, input) -> items.dislike(input.string("itemId"), caller.subject()).map(ClothingItemController::data));
    }

    private static Reply data(ClothingItem item) {
        return Reply.ok(new DataResponse<>(ClothingItemResponse.from(item)));
    }
}
