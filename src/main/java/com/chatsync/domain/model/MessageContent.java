package com.chatsync.domain.model;

import cn.hutool.core.util.ReUtil;
import com.chatsync.common.error.ValidationException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 已校验的消息内容：text 与附件至少有一个非空。
 *
 * <p>构造即校验，下游（存储、推送）拿到的内容一定合法，不再重复判断。</p>
 */
public final class MessageContent {

    public static final int MAX_TEXT_LEN = 4096;
    public static final int MAX_ATTACHMENTS = 10;

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"]+");

    private final String text;
    private final List<AttachmentRef> attachments;

    private MessageContent(String text, List<AttachmentRef> attachments) {
        this.text = text;
        this.attachments = attachments;
    }

    public static MessageContent of(String text, List<AttachmentRef> attachments) {
        String t = text == null ? null : text.strip();
        if (t != null && t.isEmpty()) {
            t = null;
        }
        List<AttachmentRef> atts = attachments == null ? List.of() : List.copyOf(attachments);

        if (t == null && atts.isEmpty()) {
            throw new ValidationException("empty_message", "text is empty and no attachment");
        }
        if (t != null && t.length() > MAX_TEXT_LEN) {
            throw new ValidationException("text_too_long", "text length " + t.length() + " > " + MAX_TEXT_LEN);
        }
        if (atts.size() > MAX_ATTACHMENTS) {
            throw new ValidationException("too_many_attachments", atts.size() + " > " + MAX_ATTACHMENTS);
        }
        return new MessageContent(t, atts);
    }

    public static MessageContent text(String text) {
        return of(text, List.of());
    }

    public String text() {
        return text;
    }

    public List<AttachmentRef> attachments() {
        return attachments;
    }

    public String linkUrl() {
        return extractLink(text);
    }

    /**
     * 提取文本里第一个 http(s) 链接，没有返回 null。
     */
    public static String extractLink(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return ReUtil.get(URL, text, 0);
    }
}
