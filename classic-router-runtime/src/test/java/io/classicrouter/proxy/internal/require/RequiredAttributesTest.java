/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.require;

import java.security.cert.Certificate;
import java.security.cert.X509Certificate;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import javax.security.auth.x500.X500Principal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.netty.channel.Channel;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.ssl.SslHandler;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RequiredAttributesTest {

    private Channel channel;
    private ChannelPipeline pipeline;

    @BeforeEach
    void setUp() {
        channel = mock(Channel.class);
        pipeline = mock(ChannelPipeline.class);
        when(channel.pipeline()).thenReturn(pipeline);
    }

    private SSLSession withTls() {
        SslHandler sslHandler = mock(SslHandler.class);
        SSLEngine engine = mock(SSLEngine.class);
        SSLSession session = mock(SSLSession.class);
        when(pipeline.get(SslHandler.class)).thenReturn(sslHandler);
        when(sslHandler.engine()).thenReturn(engine);
        when(engine.getSession()).thenReturn(session);
        return session;
    }

    private void withCertificate(String subject, String issuer) throws SSLPeerUnverifiedException {
        X509Certificate certificate = mock(X509Certificate.class);
        when(certificate.getSubjectX500Principal()).thenReturn(new X500Principal(subject));
        when(certificate.getIssuerX500Principal()).thenReturn(new X500Principal(issuer));
        when(withTls().getPeerCertificates()).thenReturn(new Certificate[]{ certificate });
    }

    @Test
    void nothingRequired() {
        assertThatCode(() -> RequiredAttributes.enforce(channel, RequiredConnectionAttributes.NONE))
                .doesNotThrowAnyException();
    }

    @Test
    void sslRequiredButPlaintext() {
        RequiredConnectionAttributes required = new RequiredConnectionAttributes(true, null, null, null);

        assertThatThrownBy(() -> RequiredAttributes.enforce(channel, required))
                .isInstanceOf(RequirementNotMetException.class)
                .hasMessageStartingWith("ssl:");
    }

    @Test
    void sslRequiredAndEncrypted() {
        withTls();
        RequiredConnectionAttributes required = new RequiredConnectionAttributes(true, null, null, null);

        assertThatCode(() -> RequiredAttributes.enforce(channel, required))
                .doesNotThrowAnyException();
    }

    @Test
    void certificateRequiredButNonePresented() throws Exception {
        when(withTls().getPeerCertificates()).thenThrow(new SSLPeerUnverifiedException("peer not authenticated"));
        RequiredConnectionAttributes required = new RequiredConnectionAttributes(null, true, null, null);

        assertThatThrownBy(() -> RequiredAttributes.enforce(channel, required))
                .isInstanceOf(RequirementNotMetException.class)
                .hasMessageStartingWith("x509:")
                .hasCauseInstanceOf(SSLPeerUnverifiedException.class);
    }

    @Test
    void matchingSubjectAndIssuer() throws Exception {
        withCertificate("CN=app,O=Example", "CN=Example CA");
        RequiredConnectionAttributes required = new RequiredConnectionAttributes(null, null, "CN=app, O=Example", "CN=Example CA");

        assertThatCode(() -> RequiredAttributes.enforce(channel, required))
                .doesNotThrowAnyException();
    }

    @Test
    void otherSubject() throws Exception {
        withCertificate("CN=intruder", "CN=Example CA");
        RequiredConnectionAttributes required = new RequiredConnectionAttributes(null, null, "CN=app", null);

        assertThatThrownBy(() -> RequiredAttributes.enforce(channel, required))
                .isInstanceOf(RequirementNotMetException.class)
                .hasMessage("subject: client certificate has subject CN=intruder");
    }

    @Test
    void otherIssuer() throws Exception {
        withCertificate("CN=app", "CN=Other CA");
        RequiredConnectionAttributes required = new RequiredConnectionAttributes(null, null, "CN=app", "CN=Example CA");

        assertThatThrownBy(() -> RequiredAttributes.enforce(channel, required))
                .isInstanceOf(RequirementNotMetException.class)
                .hasMessageStartingWith("issuer:");
    }
}
