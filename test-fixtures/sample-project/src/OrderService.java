package sample;

/**
 * Creates orders and keeps an audit trail.
 */
public class OrderService {

    private final String region = "eu";

    public OrderService() {
    }

    /**
     * Returns the order total after the volume discount.
     */
    public long createOrder(int quantity, long price) {
        long total = quantity * price;
        long discount = total / 10;
        return total - discount;
    }

    static class Audit {
        void record(String event) {
            String line = "[audit] " + event;
            System.out.println(line);
        }
    }
}
