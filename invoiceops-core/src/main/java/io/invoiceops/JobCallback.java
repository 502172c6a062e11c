package io.invoiceops;

@FunctionalInterface
public interface JobCallback {
    void run() throws Exception;
}
