/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.kymoflow.io;

import java.io.File;
import java.io.IOException;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.ImageProcessor;

/**
 * {@link VideoSource} backed by an IJ1 {@link ImagePlus}. Every slice of the
 * image stack is treated as a frame. Frames are read straight from the stack,
 * so the image's current position is never changed.
 */
public class ImagePlusVideoSource implements VideoSource {

	private final ImagePlus imp;
	private final ImageStack stack;

	/**
	 * @param imp the image holding the video. Must be single-channel
	 */
	public ImagePlusVideoSource(final ImagePlus imp) throws IllegalArgumentException {
		if (imp == null) {
			throw new IllegalArgumentException("Image cannot be null");
		}
		if (imp.getNChannels() > 1) {
			throw new IllegalArgumentException("Single-channel video required: " + imp.getTitle() + " has "
					+ imp.getNChannels() + " channels");
		}
		this.imp = imp;
		this.stack = imp.getStack();
	}

	/**
	 * Opens a video file.
	 *
	 * @param file    the video (any format IJ can open, typically a TIFF stack)
	 * @param virtual whether frames should be read from disk on demand
	 * @return the video source
	 * @throws IOException if the file could not be opened as an image
	 */
	public static ImagePlusVideoSource open(final File file, final boolean virtual) throws IOException {
		if (file == null || !file.exists()) {
			throw new IOException("Video file not found: " + file);
		}
		final ImagePlus imp = (virtual) ? IJ.openVirtual(file.getAbsolutePath()) : IJ.openImage(file.getAbsolutePath());
		if (imp == null) {
			throw new IOException("Could not open " + file.getAbsolutePath() + " as an image");
		}
		return new ImagePlusVideoSource(imp);
	}

	@Override
	public int getFrameCount() {
		return stack.getSize();
	}

	@Override
	public int getWidth() {
		return stack.getWidth();
	}

	@Override
	public int getHeight() {
		return stack.getHeight();
	}

	@Override
	public ImageProcessor getFrame(final int frame) {
		if (frame < 1 || frame > stack.getSize()) {
			throw new IndexOutOfBoundsException("Frame " + frame + " out of range [1, " + stack.getSize() + "]");
		}
		if (stack.isVirtual()) {
			synchronized (stack) { // virtual stacks decode through shared readers
				return stack.getProcessor(frame);
			}
		}
		return stack.getProcessor(frame);
	}

	@Override
	public void setCalibration(final double pixelSize, final double frameRate) {
		final Calibration cal = imp.getCalibration();
		cal.pixelWidth = pixelSize;
		cal.pixelHeight = pixelSize;
		cal.setUnit("micron");
		cal.fps = frameRate;
		cal.frameInterval = 1d / frameRate;
		cal.setTimeUnit("sec");
	}

	/** @return the calibration of the wrapped image */
	public Calibration getCalibration() {
		return imp.getCalibration();
	}

	/** @return the wrapped image */
	public ImagePlus getImagePlus() {
		return imp;
	}

	@Override
	public String getTitle() {
		return imp.getTitle();
	}

}
