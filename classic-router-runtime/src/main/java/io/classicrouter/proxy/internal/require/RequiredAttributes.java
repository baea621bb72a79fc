/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.require;

import java.security.cert.Certificate;
import java.security.cert.X509Certificate;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.security.auth.x500.X500Principal;

import io.netty.channel.Channel;
import io.netty.handler.ssl.SslHandler;

/**
 * Enforces {@link RequiredConnectionAttributes} against the client's channel.
 * <p>
 * Certificate subject and issuer are compared with the RFC 2253 form of the certificate's names.
 * </p>
 */
public final class RequiredAttributes {

    private RequiredAttributes() {
    }

    /**
     * @param clientChannel channel of the client connection
     * @param required what the user account requires
     * @throws RequirementNotMetException if the client's connection doesn't fulfil a requirement
     */
    public static void enforce(Channel clientChannel, RequiredConnectionAttributes required) throws RequirementNotMetException {
        if (!required.requiresTls()) {
            return;
        }

        SslHandler sslHandler = clientChannel.pipeline().get(SslHandler.class);
        if (sslHandler == null) {
            throw new RequirementNotMetException("ssl: client connection is not encrypted");
        }

        if (!required.requiresCertificate()) {
            return;
        }

        X509Certificate certificate = peerCertificate(sslHandler);

        if (required.subject() != null
                && !sameName(required.subject(), certificate.getSubjectX500Principal())) {
            throw new RequirementNotMetException("subject: client certificate has subject "
                    + certificate.getSubjectX500Principal().getName());
        }

        if (required.issuer() != null
                && !sameName(required.issuer(), certificate.getIssuerX500Principal())) {
            throw new RequirementNotMetException("issuer: client certificate has issuer "
                    + certificate.getIssuerX500Principal().getName());
        }
    }

    private static X509Certificate peerCertificate(SslHandler sslHandler) throws RequirementNotMetException {
        Certificate[] peerCertificates;
        try {
            peerCertificates = sslHandler.engine().getSession().getPeerCertificates();
        }
        catch (SSLPeerUnverifiedException e) {
            throw new RequirementNotMetException("x509: client presented no certificate", e);
        }
        if (peerCertificates.length == 0 || !(peerCertificates[0] instanceof X509Certificate certificate)) {
            throw new RequirementNotMetException("x509: client presented no X.509 certificate");
        }
        return certificate;
    }

    private static boolean sameName(String expected, X500Principal actual) {
        try {
            return new X500Principal(expected).equals(actual);
        }
        catch (IllegalArgumentException e) {
            return expected.equals(actual.getName());
        }
    }
}
