package com.chatsync.domain.controller;

import com.chatsync.auth.web.AuthContext;
import com.chatsync.common.api.Result;
import com.chatsync.common.ratelimit.LimitClass;
import com.chatsync.common.ratelimit.RateLimit;
import com.chatsync.domain.dto.AddMembersRequest;
import com.chatsync.domain.dto.CreateGroupRequest;
import com.chatsync.domain.dto.GroupView;
import com.chatsync.domain.dto.UpdateGroupRequest;
import com.chatsync.domain.mutation.GroupHandler;
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

@RequiredArgsConstructor
@RestController
@RequestMapping("/groups")
public class GroupController {

    private final GroupHandler groupHandler;

    @GetMapping
    @RateLimit(LimitClass.API)
    public Result<List<GroupView>> list() {
        return Result.ok(groupHandler.list(AuthContext.requireUserId()));
    }

    @GetMapping("/search")
    @RateLimit(LimitClass.API)
    public Result<List<GroupView>> search(@RequestParam String q) {
        return Result.ok(groupHandler.search(AuthContext.requireUserId(), q));
    }

    @GetMapping("/{id}")
    @RateLimit(LimitClass.API)
    public Result<GroupView> get(@PathVariable long id) {
        return Result.ok(groupHandler.get(AuthContext.requireUserId(), id));
    }

    /**
     * 建群：创建者即群主，memberIds 里的群主 id 和重复 id 会被忽略。
     */
    @PostMapping
    @RateLimit(LimitClass.API)
    public Result<GroupView> create(@Valid @RequestBody CreateGroupRequest req) {
        return Result.ok(groupHandler.create(AuthContext.requireUserId(),
                req.name(), req.description(), req.pictureUrl(), req.memberIds()));
    }

    @PutMapping("/{id}")
    @RateLimit(LimitClass.API)
    public Result<GroupView> update(@PathVariable long id, @Valid @RequestBody UpdateGroupRequest req) {
        return Result.ok(groupHandler.updateInfo(AuthContext.requireUserId(), id, req));
    }

    @DeleteMapping("/{id}")
    @RateLimit(LimitClass.STRICT)
    public Result<Void> delete(@PathVariable long id) {
        groupHandler.delete(AuthContext.requireUserId(), id);
        return Result.okVoid();
    }

    @PostMapping("/{id}/members")
    @RateLimit(LimitClass.API)
    public Result<GroupView> addMembers(@PathVariable long id, @Valid @RequestBody AddMembersRequest req) {
        return Result.ok(groupHandler.addMembers(AuthContext.requireUserId(), id, req.userIds()));
    }

    @DeleteMapping("/{id}/members/{userId}")
    @RateLimit(LimitClass.API)
    public Result<GroupView> removeMember(@PathVariable long id, @PathVariable long userId) {
        return Result.ok(groupHandler.removeMember(AuthContext.requireUserId(), id, userId));
    }

    @PostMapping("/{id}/leave")
    @RateLimit(LimitClass.API)
    public Result<Void> leave(@PathVariable long id) {
        groupHandler.leave(AuthContext.requireUserId(), id);
        return Result.okVoid();
    }
}
