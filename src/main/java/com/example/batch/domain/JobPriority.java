package com.example.batch.domain;

/**
 * 声明顺序即优先级从低到高
 */
public enum JobPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
