package com.relay.proxy.core.constants;

/**
 * Kind of request carried by a dispatch message. Only HTTP exists today.
 */
public enum RequestType {
    HTTP
}
