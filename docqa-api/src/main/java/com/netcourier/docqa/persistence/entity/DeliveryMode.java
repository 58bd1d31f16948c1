package com.netcourier.docqa.persistence.entity;

public enum DeliveryMode {
    WHOLE,
    STREAM
}
