package com.ministation.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "station.domain")
public class StationProperties {

    /** 邀请码长度（默认 8）。 */
    private int inviteCodeLength = 8;

    /** station / 自定义角色 slug 的最大长度（默认 50）。 */
    private int slugMaxLength = 50;

    /** 列表接口 limit 上限。 */
    private int maxListLimit = 100;

    private int defaultListLimit = 20;

    /** 审计日志默认条数。 */
    private int defaultAuditLimit = 50;

    private int maxNameLength = 64;

    private int maxDescriptionLength = 1000;

    private int maxTitleLength = 200;

    private int maxPostContentLength = 10000;

    private int maxCommentLength = 2000;

    private int maxReasonLength = 500;

    public int getInviteCodeLength() {
        return inviteCodeLength;
    }

    public void setInviteCodeLength(int inviteCodeLength) {
        this.inviteCodeLength = inviteCodeLength;
    }

    public int getSlugMaxLength() {
        return slugMaxLength;
    }

    public void setSlugMaxLength(int slugMaxLength) {
        this.slugMaxLength = slugMaxLength;
    }

    public int getMaxListLimit() {
        return maxListLimit;
    }

    public void setMaxListLimit(int maxListLimit) {
        this.maxListLimit = maxListLimit;
    }

    public int getDefaultListLimit() {
        return defaultListLimit;
    }

    public void setDefaultListLimit(int defaultListLimit) {
        this.defaultListLimit = defaultListLimit;
    }

    public int getDefaultAuditLimit() {
        return defaultAuditLimit;
    }

    public void setDefaultAuditLimit(int defaultAuditLimit) {
        this.defaultAuditLimit = defaultAuditLimit;
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }

    public void setMaxNameLength(int maxNameLength) {
        this.maxNameLength = maxNameLength;
    }

    public int getMaxDescriptionLength() {
        return maxDescriptionLength;
    }

    public void setMaxDescriptionLength(int maxDescriptionLength) {
        this.maxDescriptionLength = maxDescriptionLength;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    public void setMaxTitleLength(int maxTitleLength) {
        this.maxTitleLength = maxTitleLength;
    }

    public int getMaxPostContentLength() {
        return maxPostContentLength;
    }

    public void setMaxPostContentLength(int maxPostContentLength) {
        this.maxPostContentLength = maxPostContentLength;
    }

    public int getMaxCommentLength() {
        return maxCommentLength;
    }

    public void setMaxCommentLength(int maxCommentLength) {
        this.maxCommentLength = maxCommentLength;
    }

    public int getMaxReasonLength() {
        return maxReasonLength;
    }

    public void setMaxReasonLength(int maxReasonLength) {
        this.maxReasonLength = maxReasonLength;
    }

    /** null / 非正数取默认值，超过上限截断。 */
    public int clampLimit(Integer limit, int defaultLimit) {
        if (limit == null || limit <= 0) {
            return Math.min(defaultLimit, maxListLimit);
        }
        return Math.min(limit, maxListLimit);
    }
}
