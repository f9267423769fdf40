package com.chatsync.domain.controller;

import com.chatsync.auth.web.AuthContext;
import com.chatsync.common.api.Result;
import com.chatsync.common.ratelimit.LimitClass;
import com.chatsync.common.ratelimit.RateLimit;
import com.chatsync.domain.dto.EditMessageRequest;
import com.chatsync.domain.dto.HistoryPage;
import com.chatsync.domain.dto.LastMessagesPage;
import com.chatsync.domain.dto.MediaDeleteResult;
import com.chatsync.domain.dto.MessageDeletedPayload;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.dto.ReactionRequest;
import com.chatsync.domain.dto.ReceiptPayload;
import com.chatsync.domain.dto.ReplaceImageRequest;
import com.chatsync.domain.dto.SendMessageRequest;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.enums.DeleteType;
import com.chatsync.domain.model.AttachmentRef;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.mutation.DeleteMessageHandler;
import com.chatsync.domain.mutation.EditMessageHandler;
import com.chatsync.domain.mutation.PinMessageHandler;
import com.chatsync.domain.mutation.ReactionHandler;
import com.chatsync.domain.mutation.ReceiptHandler;
import com.chatsync.domain.mutation.SendMessageHandler;
import com.chatsync.domain.service.ConversationIndexService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 消息相关 HTTP 接口。写操作成功后由各 handler 负责 WS 推送，这里只做参数转换。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/messages")
public class MessageController {

    private final ConversationIndexService index;
    private final SendMessageHandler sendHandler;
    private final EditMessageHandler editHandler;
    private final DeleteMessageHandler deleteHandler;
    private final PinMessageHandler pinHandler;
    private final ReactionHandler reactionHandler;
    private final ReceiptHandler receiptHandler;

    @GetMapping("/last")
    @RateLimit(LimitClass.API)
    public Result<LastMessagesPage> last(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return Result.ok(index.lastMessages(AuthContext.requireUserId(), page, limit));
    }

    @GetMapping("/direct/{peerId}")
    @RateLimit(LimitClass.API)
    public Result<HistoryPage> directHistory(
            @PathVariable long peerId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long before
    ) {
        long userId = AuthContext.requireUserId();
        return Result.ok(index.history(userId, ConversationKey.direct(userId, peerId), limit, before));
    }

    @GetMapping("/group/{groupId}")
    @RateLimit(LimitClass.API)
    public Result<HistoryPage> groupHistory(
            @PathVariable long groupId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long before
    ) {
        return Result.ok(index.history(AuthContext.requireUserId(), ConversationKey.group(groupId), limit, before));
    }

    @GetMapping("/direct/{peerId}/by-type")
    @RateLimit(LimitClass.API)
    public Result<List<MessageView>> directByType(
            @PathVariable long peerId,
            @RequestParam String type,
            @RequestParam(required = false) Integer limit
    ) {
        long userId = AuthContext.requireUserId();
        return Result.ok(index.byType(userId, ConversationKey.direct(userId, peerId), type, limit));
    }

    @GetMapping("/group/{groupId}/by-type")
    @RateLimit(LimitClass.API)
    public Result<List<MessageView>> groupByType(
            @PathVariable long groupId,
            @RequestParam String type,
            @RequestParam(required = false) Integer limit
    ) {
        return Result.ok(index.byType(AuthContext.requireUserId(), ConversationKey.group(groupId), type, limit));
    }

    /**
     * 收藏列表；before 传上一页最后一条消息的 id。
     */
    @GetMapping("/saved")
    @RateLimit(LimitClass.API)
    public Result<List<MessageView>> saved(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long before
    ) {
        return Result.ok(index.saved(AuthContext.requireUserId(), limit, before));
    }

    @PostMapping("/direct/{peerId}")
    @RateLimit(LimitClass.MESSAGE)
    public Result<MessageView> sendDirect(@PathVariable long peerId, @Valid @RequestBody SendMessageRequest req) {
        return Result.ok(sendHandler.sendDirect(AuthContext.requireUserId(), peerId, req.toContent(), req.toRefs()));
    }

    @PostMapping("/group/{groupId}")
    @RateLimit(LimitClass.MESSAGE)
    public Result<MessageView> sendGroup(@PathVariable long groupId, @Valid @RequestBody SendMessageRequest req) {
        return Result.ok(sendHandler.sendGroup(AuthContext.requireUserId(), groupId, req.toContent(), req.toRefs()));
    }

    @PutMapping("/{id}")
    @RateLimit(LimitClass.MESSAGE)
    public Result<MessageView> edit(@PathVariable long id, @Valid @RequestBody EditMessageRequest req) {
        return Result.ok(editHandler.editText(AuthContext.requireUserId(), id, req.text()));
    }

    @PutMapping("/{id}/image")
    @RateLimit(LimitClass.MESSAGE)
    public Result<MessageView> replaceImage(@PathVariable long id, @Valid @RequestBody ReplaceImageRequest req) {
        AttachmentRef image = new AttachmentRef(AttachmentKind.IMAGE, req.url(), req.fileName(), req.fileSize(), req.mimeType());
        return Result.ok(editHandler.replaceImage(AuthContext.requireUserId(), id, image));
    }

    @DeleteMapping("/{id}")
    @RateLimit(LimitClass.MESSAGE)
    public Result<MessageDeletedPayload> delete(@PathVariable long id, @RequestParam String deleteType) {
        return Result.ok(deleteHandler.delete(AuthContext.requireUserId(), id, DeleteType.fromString(deleteType)));
    }

    @DeleteMapping("/{id}/media")
    @RateLimit(LimitClass.MESSAGE)
    public Result<MediaDeleteResult> deleteMedia(@PathVariable long id, @RequestParam String mediaType) {
        return Result.ok(deleteHandler.deleteMedia(AuthContext.requireUserId(), id, AttachmentKind.fromString(mediaType)));
    }

    @DeleteMapping("/conversation/{peerId}")
    @RateLimit(LimitClass.STRICT)
    public Result<Map<String, Integer>> deleteConversation(@PathVariable long peerId, @RequestParam String deleteType) {
        int deleted = deleteHandler.deleteConversation(AuthContext.requireUserId(), peerId, DeleteType.fromString(deleteType));
        return Result.ok(Map.of("deleted", deleted));
    }

    @PostMapping("/{id}/pin")
    @RateLimit(LimitClass.API)
    public Result<MessageView> pin(@PathVariable long id) {
        return Result.ok(pinHandler.pin(AuthContext.requireUserId(), id));
    }

    @DeleteMapping("/{id}/pin")
    @RateLimit(LimitClass.API)
    public Result<MessageView> unpin(@PathVariable long id) {
        return Result.ok(pinHandler.unpin(AuthContext.requireUserId(), id));
    }

    @PostMapping("/{id}/reaction")
    @RateLimit(LimitClass.REALTIME)
    public Result<MessageView> react(@PathVariable long id, @Valid @RequestBody ReactionRequest req) {
        return Result.ok(reactionHandler.add(AuthContext.requireUserId(), id, req.emoji()));
    }

    @DeleteMapping("/{id}/reaction")
    @RateLimit(LimitClass.REALTIME)
    public Result<MessageView> unreact(@PathVariable long id) {
        return Result.ok(reactionHandler.remove(AuthContext.requireUserId(), id));
    }

    @PostMapping("/{id}/seen")
    @RateLimit(LimitClass.REALTIME)
    public Result<Map<String, Boolean>> seen(@PathVariable long id) {
        return Result.ok(Map.of("updated", receiptHandler.markSeen(AuthContext.requireUserId(), id)));
    }

    @PostMapping("/{id}/listened")
    @RateLimit(LimitClass.REALTIME)
    public Result<Map<String, Boolean>> listened(@PathVariable long id) {
        return Result.ok(Map.of("updated", receiptHandler.markListened(AuthContext.requireUserId(), id)));
    }

    @PostMapping("/{id}/save")
    @RateLimit(LimitClass.API)
    public Result<ReceiptPayload> save(@PathVariable long id) {
        return Result.ok(receiptHandler.save(AuthContext.requireUserId(), id));
    }

    @DeleteMapping("/{id}/save")
    @RateLimit(LimitClass.API)
    public Result<ReceiptPayload> unsave(@PathVariable long id) {
        return Result.ok(receiptHandler.unsave(AuthContext.requireUserId(), id));
    }
}
