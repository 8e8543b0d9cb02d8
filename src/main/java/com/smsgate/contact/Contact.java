package com.smsgate.contact;

public record Contact(String id, String displayName) {}
