package com.restaurantai.chat.model;

/**
 * Message categories recognised by the rule engine, in evaluation order.
 */
public enum Intent {
    GREETING,
    MENU_QUERY,
    DIETARY_QUERY,
    RECOMMENDATION_REQUEST,
    SPECIFIC_ITEM_QUERY,
    GENERAL_CONVERSATION
}
