package org.lockit.server;

public record DatabaseAdapter(String type, String adapterName) {
}
