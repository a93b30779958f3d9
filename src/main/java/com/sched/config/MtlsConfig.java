package com.sched.config;

/**
 * Mutual TLS material for plugin to API server calls.
 * The certificate/key pair is the plugin's own, signed by the private CA;
 * the CA certificate verifies the server.
 *
 * @param enable  Whether mutual TLS is used
 * @param certPem Client certificate (PEM)
 * @param keyPem  Client private key (PKCS#8 PEM)
 * @param caPem   CA certificate (PEM)
 */
public record MtlsConfig(
        boolean enable,
        String certPem,
        String keyPem,
        String caPem
) {
    public static MtlsConfig disabled() {
        return new MtlsConfig(false, null, null, null);
    }

    @Override
    public String toString() {
        return "MtlsConfig{enable=" + enable + "}";
    }
}
