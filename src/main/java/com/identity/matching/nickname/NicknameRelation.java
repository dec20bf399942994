package com.identity.matching.nickname;

/**
 * One row of the nickname dataset, e.g. {@code robert,has_nickname,bob}.
 *
 * @param name         the first name of the row
 * @param relationship relationship label; only {@value #HAS_NICKNAME} rows are used
 * @param otherName    the related name
 */
public record NicknameRelation(String name, String relationship, String otherName) {

    public static final String HAS_NICKNAME = "has_nickname";

    public boolean isNickname() {
        return relationship != null && HAS_NICKNAME.equalsIgnoreCase(relationship.trim());
    }
}
