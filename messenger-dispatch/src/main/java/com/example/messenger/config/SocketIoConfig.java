package com.example.messenger.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;

@org.springframework.context.annotation.Configuration
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(MessengerProperties messengerProperties, ObjectMapper objectMapper) {
        MessengerProperties.Socketio socketio = messengerProperties.getSocketio();
        Configuration configuration = new Configuration();
        configuration.setHostname(socketio.getHost());
        configuration.setPort(socketio.getPort());
        configuration.setOrigin("*");
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SpringJacksonJsonSupport(objectMapper));

        server = new SocketIOServer(configuration);
        server.start();
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
            server = null;
        }
    }
}
