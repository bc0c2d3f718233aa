package com.pharmaintel.domain;

public enum ExpiryAction {
    NONE,
    DISCOUNT,
    RETURN_TO_SUPPLIER,
    REDISTRIBUTE
}
