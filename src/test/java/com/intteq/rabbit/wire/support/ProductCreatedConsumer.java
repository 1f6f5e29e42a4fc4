package com.intteq.rabbit.wire.support;

import com.intteq.rabbit.wire.WireConsumer;

import java.util.ArrayList;
import java.util.List;

public class ProductCreatedConsumer implements WireConsumer<ProductCreated> {

    private final List<ProductCreated> received = new ArrayList<>();

    @Override
    public Class<ProductCreated> messageType() {
        return ProductCreated.class;
    }

    @Override
    public void handle(ProductCreated message) {
        received.add(message);
    }

    public List<ProductCreated> received() {
        return received;
    }
}
