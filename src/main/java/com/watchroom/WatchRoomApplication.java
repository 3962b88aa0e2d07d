package com.watchroom;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.watchroom.config.WatchRoomProperties;

/**
 * Watch room coordination server.
 *
 * Relays playback state, chat and voice signaling between members of small shared
 * rooms over a single WebSocket endpoint. All room state lives in memory.
 */
@SpringBootApplication
@EnableScheduling
public class WatchRoomApplication implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(WatchRoomApplication.class);

	private final WatchRoomProperties properties;

	@Value("${server.port:8080}")
	private int port;

	public WatchRoomApplication(WatchRoomProperties properties) {
		this.properties = properties;
	}

	public static void main(String[] args) {
		SpringApplication.run(WatchRoomApplication.class, args);
	}

	@Override
	public void run(String... args) {
		logger.info("=================================");
		logger.info("Watch Room Server Started");
		logger.info("=================================");
		logger.info("Local endpoint: ws://localhost:{}{}", port, properties.getEndpoint());

		String networkIp = getNetworkIp();
		if (networkIp != null) {
			logger.info("Network endpoint: ws://{}:{}{}", networkIp, port, properties.getEndpoint());
		} else {
			logger.info("Network IP not detected");
		}
		logger.info("Owner timeout {}, empty room grace period {}",
				properties.getCleanup().getOwnerTimeout(), properties.getCleanup().getGracePeriod());
		logger.info("=================================");
	}

	/**
	 * Gets a site-local IPv4 address so other devices on the LAN can connect
	 * @return Network IP address or null if not found
	 */
	private String getNetworkIp() {
		try {
			Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
			while (interfaces != null && interfaces.hasMoreElements()) {
				NetworkInterface networkInterface = interfaces.nextElement();

				// Skip loopback and non-active interfaces
				if (networkInterface.isLoopback() || !networkInterface.isUp()) {
					continue;
				}

				Enumeration<InetAddress> addresses = networkInterface.getInetAddresses();
				while (addresses.hasMoreElements()) {
					InetAddress address = addresses.nextElement();
					if (!address.isLoopbackAddress() && address.isSiteLocalAddress()) {
						return address.getHostAddress();
					}
				}
			}
		} catch (SocketException e) {
			logger.warn("Error detecting network IP: {}", e.getMessage());
		}
		return null;
	}
}
