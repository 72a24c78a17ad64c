package com.questrail.schemagrid.config;

import java.util.Objects;

/**
 * Partner and port values written into the {@code EDI_DC40} control record of
 * generated IDocs.
 *
 * <p>The grid model has no columns for these, so they are fixed per protocol
 * instance. The defaults are placeholders that a receiving system is expected
 * to overwrite.</p>
 */
public record IdocControlDefaults(
    String senderPort,
    String senderPartnerType,
    String senderPartner,
    String receiverPort,
    String receiverPartnerType,
    String receiverPartner
) {
    private static final IdocControlDefaults DEFAULTS =
        new IdocControlDefaults("SNDPOR", "LS", "SNDPRN", "RCVPOR", "LS", "RCVPRN");

    public IdocControlDefaults {
        Objects.requireNonNull(senderPort, "senderPort");
        Objects.requireNonNull(senderPartnerType, "senderPartnerType");
        Objects.requireNonNull(senderPartner, "senderPartner");
        Objects.requireNonNull(receiverPort, "receiverPort");
        Objects.requireNonNull(receiverPartnerType, "receiverPartnerType");
        Objects.requireNonNull(receiverPartner, "receiverPartner");
    }

    public static IdocControlDefaults defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String senderPort = DEFAULTS.senderPort();
        private String senderPartnerType = DEFAULTS.senderPartnerType();
        private String senderPartner = DEFAULTS.senderPartner();
        private String receiverPort = DEFAULTS.receiverPort();
        private String receiverPartnerType = DEFAULTS.receiverPartnerType();
        private String receiverPartner = DEFAULTS.receiverPartner();

        public Builder withSender(String port, String partnerType, String partner) {
            this.senderPort = port;
            this.senderPartnerType = partnerType;
            this.senderPartner = partner;
            return this;
        }

        public Builder withReceiver(String port, String partnerType, String partner) {
            this.receiverPort = port;
            this.receiverPartnerType = partnerType;
            this.receiverPartner = partner;
            return this;
        }

        public IdocControlDefaults build() {
            return new IdocControlDefaults(senderPort, senderPartnerType, senderPartner,
                receiverPort, receiverPartnerType, receiverPartner);
        }
    }
}
