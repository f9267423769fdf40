package com.chatsync.gateway.ws;

/**
 * 下行事件名。单聊与群聊同一动作使用不同事件名（群聊加 group 前缀），
 * 新消息例外：两者都是 newMessage，群消息的 data 为 {message, groupId}。
 */
public final class ChatEvents {

    private ChatEvents() {
    }

    public static final String GET_ONLINE_USERS = "getOnlineUsers";
    public static final String TYPING = "typing";
    public static final String STOP_TYPING = "stopTyping";

    public static final String NEW_MESSAGE = "newMessage";

    public static final String MESSAGE_EDITED = "messageEdited";
    public static final String GROUP_MESSAGE_EDITED = "groupMessageEdited";

    public static final String MESSAGE_DELETED = "messageDeleted";
    public static final String GROUP_MESSAGE_DELETED = "groupMessageDeleted";
    public static final String CONVERSATION_DELETED = "conversationDeleted";

    public static final String MESSAGE_PINNED = "messagePinned";
    public static final String GROUP_MESSAGE_PINNED = "groupMessagePinned";
    public static final String MESSAGE_UNPINNED = "messageUnpinned";
    public static final String GROUP_MESSAGE_UNPINNED = "groupMessageUnpinned";

    public static final String MESSAGE_REACTION_ADDED = "messageReactionAdded";
    public static final String GROUP_MESSAGE_REACTION_ADDED = "groupMessageReactionAdded";
    public static final String MESSAGE_REACTION_REMOVED = "messageReactionRemoved";
    public static final String GROUP_MESSAGE_REACTION_REMOVED = "groupMessageReactionRemoved";

    public static final String MESSAGE_SEEN_UPDATE = "messageSeenUpdate";
    public static final String GROUP_MESSAGE_SEEN = "groupMessageSeen";
    public static final String VOICE_MESSAGE_LISTENED = "voiceMessageListened";
    public static final String GROUP_VOICE_MESSAGE_LISTENED = "groupVoiceMessageListened";

    /** 收藏只通知本人的其它设备 */
    public static final String MESSAGE_SAVED = "messageSaved";
    public static final String MESSAGE_UNSAVED = "messageUnsaved";

    public static final String GROUP_CREATED = "groupCreated";
    public static final String ADDED_TO_GROUP = "addedToGroup";
    public static final String REMOVED_FROM_GROUP = "removedFromGroup";
    public static final String GROUP_INFO_UPDATED = "groupInfoUpdated";
    public static final String GROUP_DELETED = "groupDeleted";
    public static final String MEMBER_LEFT_GROUP = "memberLeftGroup";
    public static final String LEFT_GROUP = "leftGroup";
}
