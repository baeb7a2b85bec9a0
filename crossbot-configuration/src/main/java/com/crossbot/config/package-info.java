/**
 * Environment configuration and the Redis-backed scenario store.
 */
package com.crossbot.config;
